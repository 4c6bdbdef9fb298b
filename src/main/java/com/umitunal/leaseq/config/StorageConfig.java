package com.umitunal.leaseq.config;

/**
 * Configuration for the RocksDB storage engine.
 */
public class StorageConfig {
    private final String dataDirectory;
    private final boolean durableWrites;
    private final int memoryBufferSizeMB;
    private final int maxMemoryBuffers;
    private final int blockCacheSizeMB;
    private final int backgroundThreads;

    private StorageConfig(Builder builder) {
        this.dataDirectory = builder.dataDirectory;
        this.durableWrites = builder.durableWrites;
        this.memoryBufferSizeMB = builder.memoryBufferSizeMB;
        this.maxMemoryBuffers = builder.maxMemoryBuffers;
        this.blockCacheSizeMB = builder.blockCacheSizeMB;
        this.backgroundThreads = builder.backgroundThreads;
    }

    public String getDataDirectory() { return dataDirectory; }
    public boolean isDurableWrites() { return durableWrites; }
    public int getMemoryBufferSizeMB() { return memoryBufferSizeMB; }
    public int getMaxMemoryBuffers() { return maxMemoryBuffers; }
    public int getBlockCacheSizeMB() { return blockCacheSizeMB; }
    public int getBackgroundThreads() { return backgroundThreads; }

    public static Builder newBuilder(String dataDirectory) {
        return new Builder(dataDirectory);
    }

    public static class Builder {
        private final String dataDirectory;
        private boolean durableWrites = false;
        private int memoryBufferSizeMB = 64;
        private int maxMemoryBuffers = 3;
        private int blockCacheSizeMB = 128;
        private int backgroundThreads = 4;

        private Builder(String dataDirectory) {
            this.dataDirectory = dataDirectory;
        }

        /**
         * Sync the write-ahead log on every write.
         * Default: false
         */
        public Builder withDurableWrites(boolean enable) {
            this.durableWrites = enable;
            return this;
        }

        /**
         * Memtable size in MB.
         * Default: 64 MB
         */
        public Builder withMemoryBufferSize(int sizeMB) {
            this.memoryBufferSizeMB = sizeMB;
            return this;
        }

        /**
         * Default: 3
         */
        public Builder withMaxMemoryBuffers(int count) {
            this.maxMemoryBuffers = count;
            return this;
        }

        /**
         * LRU block cache size in MB.
         * Default: 128 MB
         */
        public Builder withBlockCacheSize(int sizeMB) {
            this.blockCacheSizeMB = sizeMB;
            return this;
        }

        /**
         * Background flush and compaction threads.
         * Default: 4
         */
        public Builder withBackgroundThreads(int count) {
            this.backgroundThreads = count;
            return this;
        }

        public StorageConfig build() {
            if (dataDirectory == null || dataDirectory.isBlank()) {
                throw new IllegalArgumentException("dataDirectory must not be blank");
            }
            return new StorageConfig(this);
        }
    }
}
