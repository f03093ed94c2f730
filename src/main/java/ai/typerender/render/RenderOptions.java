package ai.typerender.render;

import ai.typerender.model.NamedType;
import ai.typerender.model.TypeGraph;
import ai.typerender.model.UnionType;

import java.util.Objects;

public record RenderOptions(boolean declareUnions, DeclarationOrder declarationOrder) {
    public RenderOptions {
        Objects.requireNonNull(declarationOrder, "declarationOrder");
    }

    public static RenderOptions defaults() {
        return new RenderOptions(false, DeclarationOrder.TOPOLOGICAL);
    }

    public RenderOptions withDeclareUnions(boolean declareUnions) {
        return new RenderOptions(declareUnions, declarationOrder);
    }

    public RenderOptions withDeclarationOrder(DeclarationOrder declarationOrder) {
        return new RenderOptions(declareUnions, declarationOrder);
    }

    /**
     * Whether {@code type} gets a declaration of its own. Nullable unions
     * never do; other unions only when they are declared rather than inlined.
     */
    public boolean declares(NamedType type) {
        if (type instanceof UnionType union) {
            return declareUnions && TypeGraph.nullableOf(union).isEmpty();
        }
        return true;
    }
}
