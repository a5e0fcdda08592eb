package com.e2eq.docmap.relation;

import com.e2eq.docmap.mapping.EntityType;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.function.Supplier;

/**
 * Declares one relationship of an entity type.
 * <ul>
 *   <li>{@code embeddingPath}: the document key of an embedded value, or for a REF_MANY whose
 *   children are embedded elsewhere, the path of the embedded sequence inside the target documents.</li>
 *   <li>{@code foreignKey}: REF_ONE key on this side, REF_MANY key on the child side, MANY_TO_MANY
 *   id collection on this side.</li>
 *   <li>{@code inverseForeignKey}: MANY_TO_MANY id collection on the partner side.</li>
 * </ul>
 * The target is supplied lazily so that a type may relate to itself.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public final class RelationDescriptor {

    private final String name;
    private final RelationKind kind;
    @ToString.Exclude
    private final Supplier<? extends EntityType<?>> targetSupplier;
    private final String foreignKey;
    private final String inverseForeignKey;
    private final String embeddingPath;
    @Builder.Default
    private final CascadePolicy cascade = CascadePolicy.ORPHAN;
    @Builder.Default
    private final boolean bidirectional = true;
    private final boolean polymorphic;
    private final boolean singular;

    public EntityType<?> getTarget() {
        EntityType<?> target = targetSupplier.get();
        if (target == null) {
            throw new IllegalStateException("Relation '" + name + "' target is not initialized yet");
        }
        return target;
    }

    /**
     * Children live in their own collection and hold this side's id.
     */
    public boolean isReferencedChildren() {
        return kind == RelationKind.REF_MANY && embeddingPath == null;
    }

    /**
     * Children are embedded inside the target's documents and carry this side's id.
     */
    public boolean isEmbeddedChildren() {
        return kind == RelationKind.REF_MANY && embeddingPath != null;
    }

    public boolean participatesInCascade() {
        return isReferencedChildren() || kind == RelationKind.MANY_TO_MANY;
    }

    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("relation name is required");
        }
        if (kind == null || targetSupplier == null) {
            throw new IllegalArgumentException("relation '" + name + "' requires a kind and a target");
        }
        switch (kind) {
            case EMBED_ONE:
            case EMBED_MANY:
                require(embeddingPath, "embeddingPath");
                break;
            case REF_ONE:
                require(foreignKey, "foreignKey");
                break;
            case REF_MANY:
                if (embeddingPath == null) {
                    require(foreignKey, "foreignKey");
                }
                break;
            case MANY_TO_MANY:
                require(foreignKey, "foreignKey");
                if (bidirectional) {
                    require(inverseForeignKey, "inverseForeignKey");
                }
                break;
            default:
                break;
        }
        if (cascade != CascadePolicy.ORPHAN && !participatesInCascade()) {
            throw new IllegalArgumentException("relation '" + name + "' of kind " + kind
                    + (isEmbeddedChildren() ? " with embedded children" : "")
                    + " cannot declare cascade policy " + cascade);
        }
    }

    private void require(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("relation '" + name + "' of kind " + kind + " requires " + property);
        }
    }
}
