package com.e2eq.docmap.mapping;

import com.e2eq.docmap.cascade.PostDestroyHook;
import com.e2eq.docmap.cascade.PreDestroyHook;
import com.e2eq.docmap.codec.CodecRegistry;
import com.e2eq.docmap.codec.IdCodec;
import com.e2eq.docmap.codec.IdListCodec;
import com.e2eq.docmap.codec.ValueCodec;
import com.e2eq.docmap.relation.CascadePolicy;
import com.e2eq.docmap.relation.RelationDescriptor;
import com.e2eq.docmap.relation.RelationKind;
import org.bson.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Static descriptor of one entity class: its collection, field table, relationships, indexes,
 * identity default and destroy hooks. Built once per class, usually held in a
 * {@code public static final} constant of the entity class.
 * <p>
 * Field lookup accepts both the document key and the accessor alias. The identifier is always
 * stored under {@code _id} and may be addressed as {@code id}.
 * </p>
 *
 * @param <E> the entity class
 */
public final class EntityType<E extends DocumentEntity> {

    public static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";
    static final String ID_ALIAS = "id";

    private final Class<E> entityClass;
    private final String name;
    private final String collectionName;
    private final Function<EntityType<E>, E> factory;
    private final CodecRegistry codecs;
    private final Map<String, FieldMapping<?>> fieldsByKey;
    private final Map<String, String> keysByAlias;
    private final Map<String, RelationDescriptor> relations;
    private final Map<String, RelationDescriptor> embeddedByKey;
    private final List<Document> indexes;
    private final String identityField;
    private final boolean timestamps;
    private final List<PreDestroyHook> preDestroyHooks;
    private final List<PostDestroyHook> postDestroyHooks;
    private final UnaryOperator<Map<String, Object>> sanitizer;

    private EntityType(Builder<E> builder) {
        this.entityClass = builder.entityClass;
        this.name = builder.entityClass.getSimpleName();
        this.collectionName = builder.collectionName;
        this.factory = builder.factory;
        this.codecs = builder.codecs;
        this.fieldsByKey = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fieldsByKey));
        this.keysByAlias = Collections.unmodifiableMap(new LinkedHashMap<>(builder.keysByAlias));
        this.relations = Collections.unmodifiableMap(new LinkedHashMap<>(builder.relations));
        Map<String, RelationDescriptor> embedded = new LinkedHashMap<>();
        for (RelationDescriptor descriptor : builder.relations.values()) {
            if (descriptor.getKind().isEmbedded()) {
                embedded.put(descriptor.getEmbeddingPath(), descriptor);
            }
        }
        this.embeddedByKey = Collections.unmodifiableMap(embedded);
        this.indexes = List.copyOf(builder.indexes);
        this.identityField = builder.identityField;
        this.timestamps = builder.timestamps;
        this.preDestroyHooks = List.copyOf(builder.preDestroyHooks);
        this.postDestroyHooks = List.copyOf(builder.postDestroyHooks);
        this.sanitizer = builder.sanitizer;
    }

    public static <E extends DocumentEntity> Builder<E> builder(Class<E> entityClass, Supplier<E> factory) {
        return new Builder<>(entityClass, type -> factory.get());
    }

    /**
     * For generic entity classes whose instances need to know their type at construction.
     */
    public static <E extends DocumentEntity> Builder<E> typedBuilder(Class<E> entityClass,
                                                                     Function<EntityType<E>, E> factory) {
        return new Builder<>(entityClass, factory);
    }

    public E newInstance() {
        E entity = factory.apply(this);
        if (entity.getEntityType() != this) {
            throw new IllegalStateException("Factory for " + name + " produced an entity of type "
                    + entity.getEntityType().getName());
        }
        return entity;
    }

    public Class<E> getEntityClass() {
        return entityClass;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the collection, or {@code null} for types that only ever live embedded
     */
    public String getCollectionName() {
        return collectionName;
    }

    public boolean isRoot() {
        return collectionName != null;
    }

    public String requireCollection() {
        if (collectionName == null) {
            throw new IllegalStateException(name + " is an embedded type and has no collection of its own");
        }
        return collectionName;
    }

    public CodecRegistry getCodecs() {
        return codecs;
    }

    public String getIdentityField() {
        return identityField;
    }

    public boolean hasTimestamps() {
        return timestamps;
    }

    public List<Document> getIndexes() {
        return indexes;
    }

    public List<PreDestroyHook> getPreDestroyHooks() {
        return preDestroyHooks;
    }

    public List<PostDestroyHook> getPostDestroyHooks() {
        return postDestroyHooks;
    }

    /**
     * Translates an accessor alias to its document key. Dotted paths translate their first
     * segment only. Unknown names are returned unchanged.
     */
    public String resolveKey(String nameOrAlias) {
        if (nameOrAlias == null) {
            throw new IllegalArgumentException("field name is required");
        }
        int dot = nameOrAlias.indexOf('.');
        if (dot > 0) {
            return resolveKey(nameOrAlias.substring(0, dot)) + nameOrAlias.substring(dot);
        }
        if (ID_ALIAS.equals(nameOrAlias)) {
            return DocumentEntity.ID;
        }
        return keysByAlias.getOrDefault(nameOrAlias, nameOrAlias);
    }

    /**
     * Translates a document key to the accessor name application code uses.
     */
    public String aliasOf(String documentKey) {
        if (DocumentEntity.ID.equals(documentKey)) {
            return ID_ALIAS;
        }
        FieldMapping<?> mapping = fieldsByKey.get(documentKey);
        return mapping == null ? documentKey : mapping.getAccessorName();
    }

    public Optional<FieldMapping<?>> field(String nameOrAlias) {
        return Optional.ofNullable(fieldsByKey.get(resolveKey(nameOrAlias)));
    }

    public Collection<FieldMapping<?>> fields() {
        return fieldsByKey.values();
    }

    public Optional<RelationDescriptor> relation(String name) {
        return Optional.ofNullable(relations.get(name));
    }

    public RelationDescriptor requireRelation(String name) {
        return relation(name).orElseThrow(() ->
                new IllegalArgumentException(this.name + " declares no relation '" + name + "'"));
    }

    public Collection<RelationDescriptor> relations() {
        return relations.values();
    }

    /**
     * @return the embed relation stored under the given document key
     */
    public Optional<RelationDescriptor> embeddedRelationForKey(String documentKey) {
        return Optional.ofNullable(embeddedByKey.get(documentKey));
    }

    Map<String, Object> sanitize(Map<String, Object> params) {
        return sanitizer == null ? params : sanitizer.apply(params);
    }

    @Override
    public String toString() {
        return "EntityType[" + name + (collectionName != null ? " -> " + collectionName : "") + "]";
    }

    public static final class Builder<E extends DocumentEntity> {
        private final Class<E> entityClass;
        private final Function<EntityType<E>, E> factory;
        private final CodecRegistry codecs = CodecRegistry.defaults();
        private final Map<String, FieldMapping<?>> fieldsByKey = new LinkedHashMap<>();
        private final Map<String, String> keysByAlias = new LinkedHashMap<>();
        private final Map<String, RelationDescriptor> relations = new LinkedHashMap<>();
        private final List<Document> indexes = new ArrayList<>();
        private final List<PreDestroyHook> preDestroyHooks = new ArrayList<>();
        private final List<PostDestroyHook> postDestroyHooks = new ArrayList<>();
        private String collectionName;
        private String identityField;
        private boolean timestamps;
        private UnaryOperator<Map<String, Object>> sanitizer;

        private Builder(Class<E> entityClass, Function<EntityType<E>, E> factory) {
            if (entityClass == null || factory == null) {
                throw new IllegalArgumentException("entityClass and factory are required");
            }
            this.entityClass = entityClass;
            this.factory = factory;
        }

        public Builder<E> collection(String collectionName) {
            this.collectionName = collectionName;
            return this;
        }

        public Builder<E> codec(ValueCodec<?> codec) {
            codecs.register(codec);
            return this;
        }

        public <T> Builder<E> field(String documentKey, Class<T> valueClass) {
            return field(documentKey, null, valueClass);
        }

        public <T> Builder<E> field(String documentKey, String alias, Class<T> valueClass) {
            return field(documentKey, alias, codecs.lookup(valueClass));
        }

        public <T> Builder<E> field(String documentKey, ValueCodec<T> codec) {
            return field(documentKey, null, codec);
        }

        public <T> Builder<E> field(String documentKey, String alias, ValueCodec<T> codec) {
            if (DocumentEntity.ID.equals(documentKey) || ID_ALIAS.equals(documentKey)) {
                throw new IllegalArgumentException("the identifier is mapped implicitly");
            }
            if (fieldsByKey.containsKey(documentKey)) {
                throw new IllegalArgumentException(entityClass.getSimpleName() + " maps '" + documentKey + "' twice");
            }
            FieldMapping<T> mapping = new FieldMapping<>(documentKey, alias, codec);
            fieldsByKey.put(documentKey, mapping);
            if (mapping.isAliased()) {
                if (keysByAlias.containsKey(alias) || fieldsByKey.containsKey(alias)) {
                    throw new IllegalArgumentException("alias '" + alias + "' collides with another field");
                }
                keysByAlias.put(alias, documentKey);
            }
            return this;
        }

        /**
         * The identifier defaults to the value of {@code field} instead of a generated ObjectId.
         */
        public Builder<E> identityFrom(String field) {
            this.identityField = field;
            return this;
        }

        public Builder<E> timestamps() {
            this.timestamps = true;
            field(CREATED_AT, Instant.class);
            field(UPDATED_AT, Instant.class);
            return this;
        }

        public Builder<E> index(Document keys) {
            indexes.add(keys);
            return this;
        }

        public Builder<E> geoIndex(String path) {
            return index(new Document(path, "2dsphere"));
        }

        public Builder<E> sanitizer(UnaryOperator<Map<String, Object>> sanitizer) {
            this.sanitizer = sanitizer;
            return this;
        }

        public <T extends DocumentEntity> Builder<E> embedsOne(String name, Supplier<EntityType<T>> target) {
            return embedsOne(name, name, target, false);
        }

        public <T extends DocumentEntity> Builder<E> embedsOne(String name, String documentKey,
                                                                Supplier<EntityType<T>> target, boolean polymorphic) {
            return relation(RelationDescriptor.builder()
                    .name(name)
                    .kind(RelationKind.EMBED_ONE)
                    .targetSupplier(target)
                    .embeddingPath(documentKey)
                    .polymorphic(polymorphic)
                    .singular(true)
                    .build());
        }

        public <T extends DocumentEntity> Builder<E> embedsMany(String name, Supplier<EntityType<T>> target) {
            return relation(RelationDescriptor.builder()
                    .name(name)
                    .kind(RelationKind.EMBED_MANY)
                    .targetSupplier(target)
                    .embeddingPath(name)
                    .build());
        }

        /**
         * Declares a reference held on this side. The foreign key is mapped as an identifier field
         * unless it is the identifier itself.
         */
        public <T extends DocumentEntity> Builder<E> belongsTo(String name, Supplier<EntityType<T>> target,
                                                                String foreignKey) {
            if (!DocumentEntity.ID.equals(foreignKey) && !fieldsByKey.containsKey(foreignKey)) {
                field(foreignKey, new IdCodec());
            }
            return relation(RelationDescriptor.builder()
                    .name(name)
                    .kind(RelationKind.REF_ONE)
                    .targetSupplier(target)
                    .foreignKey(foreignKey)
                    .singular(true)
                    .build());
        }

        public <T extends DocumentEntity> Builder<E> hasMany(String name, Supplier<EntityType<T>> target,
                                                              String foreignKey, CascadePolicy cascade) {
            return relation(RelationDescriptor.builder()
                    .name(name)
                    .kind(RelationKind.REF_MANY)
                    .targetSupplier(target)
                    .foreignKey(foreignKey)
                    .cascade(cascade)
                    .build());
        }

        public <T extends DocumentEntity> Builder<E> hasOne(String name, Supplier<EntityType<T>> target,
                                                             String foreignKey, CascadePolicy cascade) {
            return relation(RelationDescriptor.builder()
                    .name(name)
                    .kind(RelationKind.REF_MANY)
                    .targetSupplier(target)
                    .foreignKey(foreignKey)
                    .cascade(cascade)
                    .singular(true)
                    .build());
        }

        /**
         * Children are embedded in the target's documents under {@code embeddingPath} and carry
         * this entity's id as their own identifier.
         */
        public <T extends DocumentEntity> Builder<E> hasManyEmbedded(String name, Supplier<EntityType<T>> target,
                                                                      String embeddingPath) {
            return relation(RelationDescriptor.builder()
                    .name(name)
                    .kind(RelationKind.REF_MANY)
                    .targetSupplier(target)
                    .embeddingPath(embeddingPath)
                    .foreignKey(DocumentEntity.ID)
                    .build());
        }

        public <T extends DocumentEntity> Builder<E> manyToMany(String name, Supplier<EntityType<T>> target,
                                                                 String foreignKey, String inverseForeignKey) {
            return manyToMany(name, target, foreignKey, inverseForeignKey, CascadePolicy.ORPHAN);
        }

        public <T extends DocumentEntity> Builder<E> manyToMany(String name, Supplier<EntityType<T>> target,
                                                                 String foreignKey, String inverseForeignKey,
                                                                 CascadePolicy cascade) {
            if (!fieldsByKey.containsKey(foreignKey)) {
                field(foreignKey, new IdListCodec());
            }
            return relation(RelationDescriptor.builder()
                    .name(name)
                    .kind(RelationKind.MANY_TO_MANY)
                    .targetSupplier(target)
                    .foreignKey(foreignKey)
                    .inverseForeignKey(inverseForeignKey)
                    .bidirectional(inverseForeignKey != null)
                    .cascade(cascade)
                    .build());
        }

        public Builder<E> relation(RelationDescriptor descriptor) {
            descriptor.validate();
            if (relations.containsKey(descriptor.getName())) {
                throw new IllegalArgumentException(entityClass.getSimpleName() + " declares relation '"
                        + descriptor.getName() + "' twice");
            }
            relations.put(descriptor.getName(), descriptor);
            return this;
        }

        public Builder<E> preDestroy(PreDestroyHook hook) {
            preDestroyHooks.add(hook);
            return this;
        }

        public Builder<E> postDestroy(PostDestroyHook hook) {
            postDestroyHooks.add(hook);
            return this;
        }

        public EntityType<E> build() {
            if (identityField != null && !fieldsByKey.containsKey(identityField)) {
                throw new IllegalArgumentException(entityClass.getSimpleName()
                        + " derives identity from unmapped field '" + identityField + "'");
            }
            return new EntityType<>(this);
        }
    }
}
