package com.solar.anomaly.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AerospikeConfig {

    public static final String SET_SOLAR_UNITS = "solar_units";
    public static final String SET_ENERGY_READINGS = "energy_readings";
    public static final String SET_ANOMALIES = "anomalies";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:solar}")
    private String namespace;

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 100;
        clientPolicy.timeout = 5000;

        clientPolicy.readPolicyDefault.totalTimeout = 3000;
        clientPolicy.readPolicyDefault.socketTimeout = 1000;

        clientPolicy.writePolicyDefault.totalTimeout = 3000;
        clientPolicy.writePolicyDefault.socketTimeout = 1000;

        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        policy.sendKey = true;
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
