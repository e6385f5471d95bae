// file: core/src/main/java/io/hybriddb/core/quickfind/ChangedShard.java
package io.hybriddb.core.quickfind;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.hybriddb.core.Document;

import java.util.List;

/** Authoritative contents of one shard whose hash differed from the client's. */
public record ChangedShard(int shard, List<Document> docs) {

    @JsonCreator
    public ChangedShard(@JsonProperty("shard") int shard, @JsonProperty("docs") List<Document> docs) {
        this.shard = shard;
        this.docs = docs == null ? List.of() : List.copyOf(docs);
    }
}
