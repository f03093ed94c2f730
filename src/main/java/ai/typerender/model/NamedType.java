package ai.typerender.model;

/**
 * A type that needs a top-level declaration. Equality is identity: two named
 * types with the same shape are still distinct declarations.
 */
public sealed interface NamedType extends Type permits ClassType, EnumType, UnionType {

    String name();
}
