package org.neuralchilli.sentinel.config;

import com.hazelcast.config.Config;
import com.hazelcast.config.SerializationConfig;
import com.hazelcast.config.SerializerConfig;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.sentinel.domain.WorkerRegistration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the Hazelcast instance that backs the task queue backend.
 * The container owns the instance and shuts it down on teardown.
 */
@ApplicationScoped
public class HazelcastConfig {

    private static final Logger log = LoggerFactory.getLogger(HazelcastConfig.class);

    @ConfigProperty(name = "hazelcast.client.cluster-name", defaultValue = "sentinel-dev")
    String clusterName;

    @Produces
    @Singleton
    @Startup
    public HazelcastInstance hazelcastInstance() {
        log.info("Initializing Hazelcast with cluster name: {}", clusterName);

        HazelcastInstance instance = Hazelcast.newHazelcastInstance(embeddedConfig(clusterName));
        log.info("Hazelcast instance created successfully");
        return instance;
    }

    void shutdown(@Disposes HazelcastInstance instance) {
        if (instance.getLifecycleService().isRunning()) {
            log.info("Shutting down Hazelcast instance");
            instance.getLifecycleService().shutdown();
        }
    }

    /**
     * Standalone member config: no network join, domain serializers registered.
     */
    public static Config embeddedConfig(String clusterName) {
        Config config = new Config();
        config.setClusterName(clusterName);

        config.getNetworkConfig().getJoin().getMulticastConfig().setEnabled(false);
        config.getNetworkConfig().getJoin().getTcpIpConfig().setEnabled(false);

        registerSerializers(config.getSerializationConfig());
        return config;
    }

    /**
     * Register custom serializers for everything stored in Hazelcast.
     */
    public static void registerSerializers(SerializationConfig serializationConfig) {
        serializationConfig.addSerializerConfig(new SerializerConfig()
                .setTypeClass(WorkerRegistration.class)
                .setImplementation(new HazelcastSerializers.WorkerRegistrationSerializer()));
        log.debug("Registered WorkerRegistrationSerializer (TYPE_ID: {})",
                HazelcastSerializers.WorkerRegistrationSerializer.TYPE_ID);
    }
}
