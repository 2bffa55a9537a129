package com.lawgraph.draftimpact.dto.draft;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of amending action a directive performs on existing law.
 */
public enum AmendmentType {
    STRIKE_INSERT("strike_insert"),
    REPEAL("repeal"),
    ADD_NEW_SECTION("add_new_section"),
    ADD_AT_END("add_at_end"),
    REDESIGNATE("redesignate"),
    TABLE_OF_CONTENTS("table_of_contents");

    private final String label;

    AmendmentType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static AmendmentType fromString(String value) {
        if (value == null) {
            return null;
        }
        for (AmendmentType type : values()) {
            if (type.label.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        return null;
    }
}
