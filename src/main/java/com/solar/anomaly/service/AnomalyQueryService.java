package com.solar.anomaly.service;

import com.solar.anomaly.exception.ResourceNotFoundException;
import com.solar.anomaly.model.Anomaly;
import com.solar.anomaly.model.AnomalyFilter;
import com.solar.anomaly.model.AnomalyPage;
import com.solar.anomaly.repository.AnomalyRepository;
import com.solar.anomaly.repository.SolarUnitRepository;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class AnomalyQueryService {

    private final AnomalyRepository anomalyRepository;
    private final SolarUnitRepository solarUnitRepository;

    public AnomalyQueryService(AnomalyRepository anomalyRepository,
                               SolarUnitRepository solarUnitRepository) {
        this.anomalyRepository = anomalyRepository;
        this.solarUnitRepository = solarUnitRepository;
    }

    public Anomaly getById(String anomalyId) {
        Anomaly anomaly = anomalyRepository.findById(anomalyId);
        if (anomaly == null) {
            throw new ResourceNotFoundException("Anomaly", anomalyId);
        }
        return anomaly;
    }

    public List<Anomaly> listForDevice(String unitId, AnomalyFilter filter) {
        if (solarUnitRepository.findById(unitId) == null) {
            throw new ResourceNotFoundException("Solar unit", unitId);
        }
        return anomalyRepository.query(filter.forUnit(unitId));
    }

    public AnomalyPage listAll(AnomalyFilter filter) {
        List<Anomaly> anomalies = anomalyRepository.query(filter);
        long total = anomalyRepository.count(filter);
        return new AnomalyPage(anomalies, total);
    }
}
