package com.solar.anomaly.seeder;

import com.solar.anomaly.config.DetectionConfig;
import com.solar.anomaly.model.EnergyReading;
import com.solar.anomaly.model.SolarUnit;
import com.solar.anomaly.model.SolarUnitStatus;
import com.solar.anomaly.repository.EnergyReadingRepository;
import com.solar.anomaly.repository.SolarUnitRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Random;
import java.util.UUID;
import java.util.function.IntToDoubleFunction;

/**
 * Seeds Aerospike with solar units and two-hourly readings for local testing.
 * Only runs when the "seed" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=seed
 *
 * Every unit is 5 kW. SU-0001 is healthy; SU-0002 to SU-0007 each carry one
 * injected fault so that a detection run surfaces every anomaly type; SU-0008
 * is inactive and must be ignored.
 */
@Component
@Profile("seed")
@Order(1)
public class DataSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    private static final double CAPACITY_W = 5000.0;
    private static final double NORMAL_DAY = 22_000.0;
    // Readings every 2 hours from 06:00 to 16:00 UTC carry the day's energy.
    private static final int[] DAYLIGHT_HOURS = {6, 8, 10, 12, 14, 16};
    private static final double[] DAYLIGHT_SHARE = {0.05, 0.15, 0.25, 0.25, 0.20, 0.10};

    private final SolarUnitRepository unitRepository;
    private final EnergyReadingRepository readingRepository;
    private final DetectionConfig config;
    private final Clock clock;
    private final Random random = new Random(42); // fixed seed for reproducibility

    public DataSeeder(SolarUnitRepository unitRepository,
                      EnergyReadingRepository readingRepository,
                      DetectionConfig config,
                      Clock clock) {
        this.unitRepository = unitRepository;
        this.readingRepository = readingRepository;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public void run(String... args) {
        log.info("=== Starting data seeding ===");
        int days = config.getWindowDays() + 1;

        seedUnit("SU-0001", SolarUnitStatus.ACTIVE, days, day -> normal());
        // Last two days dead.
        seedUnit("SU-0002", SolarUnitStatus.ACTIVE, days, day -> day >= days - 2 ? 0.0 : normal());
        // One day at 30% of normal.
        seedUnit("SU-0003", SolarUnitStatus.ACTIVE, days, day -> day == days - 4 ? NORMAL_DAY * 0.3 : normal());
        // Steady 4% per day decline.
        seedUnit("SU-0004", SolarUnitStatus.ACTIVE, days, day -> NORMAL_DAY * (1.0 - 0.04 * day));
        // One impossible reading.
        seedUnit("SU-0005", SolarUnitStatus.ACTIVE, days, day -> day == days - 3 ? 70_000.0 : normal());
        // Dead every third day, producing in between.
        seedUnit("SU-0006", SolarUnitStatus.ACTIVE, days, day -> day % 3 == 2 ? 0.0 : normal());
        // Persistent underperformance below 20% of the expected output.
        seedUnit("SU-0007", SolarUnitStatus.ACTIVE, days, day -> 3000.0 + random.nextDouble() * 500.0);
        seedUnit("SU-0008", SolarUnitStatus.INACTIVE, days, day -> 0.0);

        log.info("=== Data seeding complete ===");
    }

    private void seedUnit(String unitId, SolarUnitStatus status, int days, IntToDoubleFunction dailyTotal) {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        LocalDate firstDay = today.minusDays(days - 1L);

        unitRepository.save(SolarUnit.builder()
                .unitId(unitId)
                .serialNumber("SN-" + unitId)
                .capacityWatts(CAPACITY_W)
                .status(status)
                .installationDate(firstDay.minusYears(1))
                .build());

        int readings = 0;
        for (int day = 0; day < days; day++) {
            LocalDate date = firstDay.plusDays(day);
            double total = dailyTotal.applyAsDouble(day);
            for (int slot = 0; slot < DAYLIGHT_HOURS.length; slot++) {
                long timestamp = date.atTime(DAYLIGHT_HOURS[slot], 0).toInstant(ZoneOffset.UTC).toEpochMilli();
                readingRepository.save(EnergyReading.builder()
                        .readingId(UUID.randomUUID().toString())
                        .unitId(unitId)
                        .timestamp(timestamp)
                        .energyGenerated(total * DAYLIGHT_SHARE[slot])
                        .build());
                readings++;
            }
        }
        log.info("Seeded unit {} ({}) with {} readings over {} days", unitId, status, readings, days);
    }

    private double normal() {
        return NORMAL_DAY * (0.95 + random.nextDouble() * 0.1);
    }
}
