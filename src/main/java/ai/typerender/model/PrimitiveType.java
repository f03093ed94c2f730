package ai.typerender.model;

import java.util.Locale;

public enum PrimitiveType implements Type {
    NONE,
    ANY,
    NULL,
    BOOL,
    INTEGER,
    DOUBLE,
    STRING,
    DATE,
    TIME,
    DATE_TIME;

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return switch (this) {
            case NONE -> visitor.visitNone();
            case ANY -> visitor.visitAny();
            case NULL -> visitor.visitNull();
            case BOOL -> visitor.visitBool();
            case INTEGER -> visitor.visitInteger();
            case DOUBLE -> visitor.visitDouble();
            case STRING -> visitor.visitString();
            case DATE -> visitor.visitDate();
            case TIME -> visitor.visitTime();
            case DATE_TIME -> visitor.visitDateTime();
        };
    }

    @Override
    public String kindName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public static PrimitiveType fromKindName(String kindName) {
        for (PrimitiveType type : values()) {
            if (type.kindName().equals(kindName)) {
                return type;
            }
        }
        return null;
    }
}
