package ai.typerender.model;

public sealed interface Type permits PrimitiveType, ArrayType, MapType, NamedType {

    <R> R accept(TypeVisitor<R> visitor);

    /**
     * Short label used when a name has to be derived from the type itself.
     */
    String kindName();
}
