// file: core/src/main/java/io/hybriddb/core/query/FindOptions.java
package io.hybriddb.core.query;

import java.util.List;
import java.util.Map;

/**
 * Query shaping options.
 *
 * @param fields  projection: {field: 1} includes, {field: 0} excludes; null for whole documents
 * @param sort    sort specification accepted by {@link SortCompiler}; null for natural order
 * @param skip    number of leading results to drop; null or 0 for none
 * @param limit   maximum number of results; null or 0 for no limit
 * @param exclude ids that a cache refresh must neither cache nor evict
 */
public record FindOptions(
        Map<String, Object> fields,
        Object sort,
        Integer skip,
        Integer limit,
        List<String> exclude
) {
    public static final FindOptions NONE = new FindOptions(null, null, null, null, null);

    public FindOptions {
        if (skip != null && skip < 0) throw new IllegalArgumentException("skip must be >= 0");
        if (limit != null && limit < 0) throw new IllegalArgumentException("limit must be >= 0");
        exclude = exclude == null ? List.of() : List.copyOf(exclude);
    }

    public static FindOptions orNone(FindOptions options) {
        return options == null ? NONE : options;
    }

    public static FindOptions sorted(Object sort) {
        return NONE.withSort(sort);
    }

    public FindOptions withFields(Map<String, Object> fields) {
        return new FindOptions(fields, sort, skip, limit, exclude);
    }

    public FindOptions withSort(Object sort) {
        return new FindOptions(fields, sort, skip, limit, exclude);
    }

    public FindOptions withSkip(Integer skip) {
        return new FindOptions(fields, sort, skip, limit, exclude);
    }

    public FindOptions withLimit(Integer limit) {
        return new FindOptions(fields, sort, skip, limit, exclude);
    }

    public FindOptions withExclude(List<String> exclude) {
        return new FindOptions(fields, sort, skip, limit, exclude);
    }

    public boolean hasFields() {
        return fields != null && !fields.isEmpty();
    }

    public boolean hasLimit() {
        return limit != null && limit > 0;
    }

    public boolean hasSkip() {
        return skip != null && skip > 0;
    }
}
