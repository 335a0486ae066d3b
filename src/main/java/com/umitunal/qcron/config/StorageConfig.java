package com.umitunal.qcron.config;

/**
 * Configuration for the RocksDB-backed job store.
 */
public class StorageConfig {
    private final String dataDirectory;
    private final boolean durableWrites;
    private final int memoryBufferSizeMB;
    private final int blockCacheSizeMB;
    private final int backgroundThreads;

    private StorageConfig(Builder builder) {
        this.dataDirectory = builder.dataDirectory;
        this.durableWrites = builder.durableWrites;
        this.memoryBufferSizeMB = builder.memoryBufferSizeMB;
        this.blockCacheSizeMB = builder.blockCacheSizeMB;
        this.backgroundThreads = builder.backgroundThreads;
    }

    public String getDataDirectory() { return dataDirectory; }
    public boolean isDurableWrites() { return durableWrites; }
    public int getMemoryBufferSizeMB() { return memoryBufferSizeMB; }
    public int getBlockCacheSizeMB() { return blockCacheSizeMB; }
    public int getBackgroundThreads() { return backgroundThreads; }

    public static Builder newBuilder(String dataDirectory) {
        return new Builder(dataDirectory);
    }

    public static class Builder {
        private final String dataDirectory;
        private boolean durableWrites = true;
        private int memoryBufferSizeMB = 16;
        private int blockCacheSizeMB = 32;
        private int backgroundThreads = 2;

        private Builder(String dataDirectory) {
            this.dataDirectory = dataDirectory;
        }

        /**
         * Sync the write-ahead log on every write, so a committed lease or
         * reschedule survives a crash of the host.
         * Default: true
         */
        public Builder withDurableWrites(boolean enable) {
            this.durableWrites = enable;
            return this;
        }

        /**
         * Set memtable size in MB.
         * Default: 16 MB
         */
        public Builder withMemoryBufferSize(int sizeMB) {
            this.memoryBufferSizeMB = sizeMB;
            return this;
        }

        /**
         * Set block cache size in MB.
         * Default: 32 MB
         */
        public Builder withBlockCacheSize(int sizeMB) {
            this.blockCacheSizeMB = sizeMB;
            return this;
        }

        /**
         * Set number of background flush and compaction threads.
         * Default: 2
         */
        public Builder withBackgroundThreads(int count) {
            this.backgroundThreads = count;
            return this;
        }

        public StorageConfig build() {
            if (dataDirectory == null || dataDirectory.isBlank()) {
                throw new IllegalArgumentException("dataDirectory is required");
            }
            return new StorageConfig(this);
        }
    }
}
