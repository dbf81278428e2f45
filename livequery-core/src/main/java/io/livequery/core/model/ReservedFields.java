// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.core.model;

import java.util.Set;

/**
 * Metadata field names stamped onto every published document.
 *
 * <p>Application documents must not use these names; readers strip them before
 * handing documents to application code.
 */
public final class ReservedFields {

    public static final String SEARCH_DEFINITION = "__searchDefinition";
    public static final String SEARCH_OPTIONS = "__searchOptions";
    public static final String SORT_POSITION = "__sortPosition";
    public static final String ORIGINAL_ID = "__originalId";

    public static final Set<String> ALL = Set.of(SEARCH_DEFINITION, SEARCH_OPTIONS, SORT_POSITION, ORIGINAL_ID);

    private ReservedFields() {
    }

    public static boolean isReserved(final String field) {
        return ALL.contains(field);
    }
}
