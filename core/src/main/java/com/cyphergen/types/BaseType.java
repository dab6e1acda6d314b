package com.cyphergen.types;

/**
 * The fixed Cypher value types.
 */
public enum BaseType implements CypherType {
    ANY("ANY"),
    BOOLEAN("BOOLEAN"),
    DATE("DATE"),
    DURATION("DURATION"),
    FLOAT("FLOAT"),
    INTEGER("INTEGER"),
    LOCAL_DATETIME("LOCAL DATETIME"),
    LOCAL_TIME("LOCAL TIME"),
    MAP("MAP"),
    NODE("NODE"),
    NOTHING("NOTHING"),
    NULL("NULL"),
    PATH("PATH"),
    POINT("POINT"),
    PROPERTY_VALUE("PROPERTY VALUE"),
    RELATIONSHIP("RELATIONSHIP"),
    STRING("STRING"),
    ZONED_DATETIME("ZONED DATETIME"),
    ZONED_TIME("ZONED TIME");

    private final String typeName;

    BaseType(String typeName) {
        this.typeName = typeName;
    }

    @Override
    public String typeName() {
        return typeName;
    }

    @Override
    public String toString() {
        return typeName;
    }
}
