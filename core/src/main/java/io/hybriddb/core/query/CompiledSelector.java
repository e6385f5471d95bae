// file: core/src/main/java/io/hybriddb/core/query/CompiledSelector.java
package io.hybriddb.core.query;

import io.hybriddb.core.Document;

import java.util.List;
import java.util.function.Predicate;

/**
 * Output of {@link SelectorCompiler}: the boolean predicate plus the top-level
 * spatial clauses that need a separate post-filter stage.
 */
public record CompiledSelector(Predicate<Document> predicate, List<GeoClause> geoClauses) {

    public CompiledSelector {
        geoClauses = List.copyOf(geoClauses);
    }

    public boolean test(Document doc) {
        return predicate.test(doc);
    }
}
