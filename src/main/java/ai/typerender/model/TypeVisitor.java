package ai.typerender.model;

public interface TypeVisitor<R> {

    R visitNone();

    R visitAny();

    R visitNull();

    R visitBool();

    R visitInteger();

    R visitDouble();

    R visitString();

    R visitDate();

    R visitTime();

    R visitDateTime();

    R visitArray(ArrayType arrayType);

    R visitMap(MapType mapType);

    R visitClass(ClassType classType);

    R visitEnum(EnumType enumType);

    R visitUnion(UnionType unionType);
}
