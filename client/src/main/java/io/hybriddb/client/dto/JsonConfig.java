// file: client/src/main/java/io/hybriddb/client/dto/JsonConfig.java
package io.hybriddb.client.dto;

import io.hybriddb.client.HybridOptions;

import java.util.Map;

/** Raw shape of the JSON configuration file; validated by {@link io.hybriddb.client.HybridConfig}. */
public class JsonConfig {
    public String baseUrl;
    public String clientId;
    public String storage;
    public String storageDir;
    public Integer timeoutMillis;
    public Integer uploadBatchSize;
    public Integer quickfindShards;
    public Boolean usePostFind;
    public Integer maxUrlLength;
    public HybridOptions defaults;
    public Map<String, HybridOptions> collections;
}
