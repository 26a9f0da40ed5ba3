package com.address.resolution.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Node of a structured premises address as returned by the lookup service.
 * The tree is built once from the provider JSON and then only read, by the
 * similarity matcher and by the field extractor.
 */
public sealed interface AddressNode
        permits AddressNode.Text, AddressNode.Group, AddressNode.StreetOrVillage, AddressNode.Other {

    /**
     * The JSON key this node was read from.
     */
    String name();

    /**
     * Text value of this node when it is a scalar leaf.
     */
    default Optional<String> text() {
        return Optional.empty();
    }

    /**
     * Resolves a child of this node by key. Only composite nodes have children.
     */
    default Optional<AddressNode> child(String key) {
        return Optional.empty();
    }

    /**
     * Walks the given key path from this node and returns the text of the node it ends on.
     */
    default Optional<String> find(List<String> path) {
        AddressNode current = this;
        for (String key : path) {
            Optional<AddressNode> next = current.child(key);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return current.text();
    }

    /**
     * A string leaf.
     */
    record Text(String name, String value) implements AddressNode {
        public Text {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(value, "value is required");
        }

        @Override
        public Optional<String> text() {
            return Optional.of(value);
        }
    }

    /**
     * A leaf of any other JSON shape (number, boolean, array). Ignored when scoring.
     */
    record Other(String name, String rendered) implements AddressNode {
        public Other {
            Objects.requireNonNull(name, "name is required");
        }

        @Override
        public Optional<String> text() {
            return Optional.ofNullable(rendered);
        }
    }

    /**
     * A nested object. Children keep the order of the provider document.
     */
    record Group(String name, List<AddressNode> children) implements AddressNode {
        public Group {
            Objects.requireNonNull(name, "name is required");
            children = children != null ? List.copyOf(children) : List.of();
        }

        @Override
        public Optional<AddressNode> child(String key) {
            for (AddressNode node : children) {
                if (node.name().equals(key)) {
                    return Optional.of(node);
                }
            }
            return Optional.empty();
        }
    }

    /**
     * A street or village block carrying an optional building number range.
     * A building number is {@code null} when the provider omitted the key and is kept
     * verbatim (possibly empty) otherwise.
     */
    record StreetOrVillage(
            String name,
            String streetName,
            String villageName,
            String buildingNoFrom,
            String buildingNoTo
    ) implements AddressNode {

        public static final String STREET_NAME = "StreetName";
        public static final String VILLAGE_NAME = "VillageName";
        public static final String BUILDING_NO_FROM = "BuildingNoFrom";
        public static final String BUILDING_NO_TO = "BuildingNoTo";

        public StreetOrVillage {
            Objects.requireNonNull(name, "name is required");
            if (streetName == null && villageName == null) {
                throw new IllegalArgumentException(name + " requires a StreetName or VillageName");
            }
        }

        /**
         * Key of the name token used for matching. A village name takes precedence.
         */
        public String nameKey() {
            return villageName != null ? VILLAGE_NAME : STREET_NAME;
        }

        public String nameValue() {
            return villageName != null ? villageName : streetName;
        }

        @Override
        public Optional<AddressNode> child(String key) {
            String value = switch (key) {
                case STREET_NAME -> streetName;
                case VILLAGE_NAME -> villageName;
                case BUILDING_NO_FROM -> buildingNoFrom;
                case BUILDING_NO_TO -> buildingNoTo;
                default -> null;
            };
            return value == null ? Optional.empty() : Optional.of(new Text(key, value));
        }
    }
}
