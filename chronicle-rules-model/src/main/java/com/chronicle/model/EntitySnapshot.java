package com.chronicle.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Point-in-time document of one entity: identity plus its state fields, with variables under {@code "variables"}.
 * Patch paths address this document, so {@code /variables/gold} targets a variable and {@code /isResolved}
 * targets a state field. Immutable; {@link #withDocument(ObjectNode)} returns a new snapshot.
 */
public final class EntitySnapshot {

    public static final String VARIABLES_FIELD = "variables";
    private static final String TYPE_FIELD = "entityType";
    private static final String ID_FIELD = "entityId";

    private final EntityRef ref;
    private final ObjectNode document;

    public EntitySnapshot(EntityRef ref, ObjectNode document) {
        this.ref = Objects.requireNonNull(ref, "ref");
        if (ref.isTypeLevel()) {
            throw new IllegalArgumentException("Snapshot requires a concrete entity id: " + ref);
        }
        ObjectNode doc = document != null ? document.deepCopy() : JsonNodeFactory.instance.objectNode();
        doc.remove(TYPE_FIELD);
        doc.remove(ID_FIELD);
        if (!doc.path(VARIABLES_FIELD).isObject()) {
            doc.set(VARIABLES_FIELD, JsonNodeFactory.instance.objectNode());
        }
        this.document = doc;
    }

    public static EntitySnapshot of(EntityRef ref, VariableState variables) {
        ObjectNode doc = JsonNodeFactory.instance.objectNode();
        doc.set(VARIABLES_FIELD, (variables != null ? variables : VariableState.empty()).toObjectNode());
        return new EntitySnapshot(ref, doc);
    }

    /**
     * Reads {@code {"entityType": ..., "entityId": ..., "variables": {...}, ...}}.
     *
     * @throws IllegalArgumentException when the type is unknown or the id is missing
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static EntitySnapshot fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Entity snapshot must be a JSON object");
        }
        String type = node.path(TYPE_FIELD).asText(null);
        if (type == null) throw new IllegalArgumentException("Entity snapshot is missing entityType");
        EntityType entityType = EntityType.valueOf(type);
        String id = node.path(ID_FIELD).asText(null);
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Entity snapshot is missing entityId");
        return new EntitySnapshot(EntityRef.of(entityType, id), (ObjectNode) node);
    }

    public EntityRef getRef() {
        return ref;
    }

    /** Copy of the full document (without identity fields). */
    public ObjectNode getDocument() {
        return document.deepCopy();
    }

    public VariableState getVariables() {
        return VariableState.of(document.get(VARIABLES_FIELD));
    }

    /** Boolean state field, false when absent or not a boolean. */
    public boolean flag(String field) {
        return document.path(field).asBoolean(false);
    }

    public EntitySnapshot withDocument(ObjectNode newDocument) {
        return new EntitySnapshot(ref, newDocument);
    }

    public EntitySnapshot withVariables(VariableState variables) {
        ObjectNode doc = document.deepCopy();
        doc.set(VARIABLES_FIELD, (variables != null ? variables : VariableState.empty()).toObjectNode());
        return new EntitySnapshot(ref, doc);
    }

    @JsonValue
    public ObjectNode toJson() {
        ObjectNode out = JsonNodeFactory.instance.objectNode();
        out.put(TYPE_FIELD, ref.entityType().name());
        out.put(ID_FIELD, ref.entityId());
        out.setAll(document.deepCopy());
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntitySnapshot)) return false;
        EntitySnapshot that = (EntitySnapshot) o;
        return ref.equals(that.ref) && document.equals(that.document);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ref, document);
    }

    @Override
    public String toString() {
        return ref + " " + document;
    }
}
