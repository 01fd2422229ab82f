package fr.lapetina.forwarder.infrastructure.config;

/**
 * Root configuration object for the forwarder.
 * Designed to be populated from YAML.
 */
public class ForwarderConfig {

    private CacheConfig cache = new CacheConfig();
    private WorkerConfig worker = new WorkerConfig();
    private DispatchConfig dispatch = new DispatchConfig();
    private TransportConfig transport = new TransportConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public CacheConfig getCache() { return cache; }
    public void setCache(CacheConfig cache) { this.cache = cache; }

    public WorkerConfig getWorker() { return worker; }
    public void setWorker(WorkerConfig worker) { this.worker = worker; }

    public DispatchConfig getDispatch() { return dispatch; }
    public void setDispatch(DispatchConfig dispatch) { this.dispatch = dispatch; }

    public TransportConfig getTransport() { return transport; }
    public void setTransport(TransportConfig transport) { this.transport = transport; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Workers cache configuration.
     */
    public static class CacheConfig {
        private int capacity = 1024;

        public int getCapacity() { return capacity; }
        public void setCapacity(int capacity) { this.capacity = capacity; }
    }

    /**
     * Per-destination worker configuration.
     */
    public static class WorkerConfig {
        private int channelSize = 8;
        private int maxConsecutiveFailures = 3;

        public int getChannelSize() { return channelSize; }
        public void setChannelSize(int channelSize) { this.channelSize = channelSize; }

        public int getMaxConsecutiveFailures() { return maxConsecutiveFailures; }
        public void setMaxConsecutiveFailures(int maxConsecutiveFailures) { this.maxConsecutiveFailures = maxConsecutiveFailures; }
    }

    /**
     * LMAX Disruptor dispatch configuration.
     */
    public static class DispatchConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private boolean backpressure = false;
        private long shutdownTimeoutMs = 30000;

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public boolean isBackpressure() { return backpressure; }
        public void setBackpressure(boolean backpressure) { this.backpressure = backpressure; }

        public long getShutdownTimeoutMs() { return shutdownTimeoutMs; }
        public void setShutdownTimeoutMs(long shutdownTimeoutMs) { this.shutdownTimeoutMs = shutdownTimeoutMs; }
    }

    /**
     * HTTP transport configuration.
     */
    public static class TransportConfig {
        private long connectTimeoutMs = 5000;
        private long requestTimeoutMs = 10000;
        private String path = "transactions";

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private String prefix = "batch_forwarder";

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
