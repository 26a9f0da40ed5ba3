package com.address.resolution.ogcio;

import com.address.resolution.core.model.AddressNode;
import com.address.resolution.core.model.Candidate;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Converts the {@code SuggestedAddress} array of an OGCIO lookup response into candidates.
 *
 * <p>Expected shape of each suggestion:</p>
 * <pre>
 * {
 *   "Address": {
 *     "PremisesAddress": {
 *       "ChiPremisesAddress": { "Region": "香港", "ChiStreet": { "StreetName": "皇后大道中", "BuildingNoFrom": "99" }, ... },
 *       "EngPremisesAddress": { "Region": "HK", "EngStreet": { ... }, ... },
 *       "GeospatialInformation": { "Latitude": "22.28", "Longitude": "114.15", ... }
 *     }
 *   },
 *   "ValidationInformation": { "Score": 72.5 }
 * }
 * </pre>
 */
public class CandidateFlattener {

    static final String CHI_STREET = "ChiStreet";
    static final String CHI_VILLAGE = "ChiVillage";

    /**
     * Flattens every suggestion. The rank of a candidate is its index in {@code suggestions}.
     *
     * @throws MalformedSuggestionException if any suggestion lacks a required path
     */
    public List<Candidate> flatten(JsonNode suggestions) {
        if (suggestions == null || !suggestions.isArray()) {
            throw new MalformedSuggestionException(0, "suggestions must be a JSON array");
        }
        List<Candidate> candidates = new ArrayList<>(suggestions.size());
        for (int rank = 0; rank < suggestions.size(); rank++) {
            candidates.add(flattenOne(suggestions.get(rank), rank));
        }
        return candidates;
    }

    Candidate flattenOne(JsonNode suggestion, int rank) {
        JsonNode premises = require(suggestion, rank, "Address", "PremisesAddress");
        JsonNode chinese = require(premises, rank, "ChiPremisesAddress");
        JsonNode english = require(premises, rank, "EngPremisesAddress");
        JsonNode geo = require(premises, rank, "GeospatialInformation");
        JsonNode score = require(suggestion, rank, "ValidationInformation", "Score");

        if (!chinese.isObject()) {
            throw new MalformedSuggestionException(rank, "ChiPremisesAddress is not an object");
        }
        if (!english.isObject()) {
            throw new MalformedSuggestionException(rank, "EngPremisesAddress is not an object");
        }

        return new Candidate(
                rank,
                toGroup("ChiPremisesAddress", chinese, rank),
                toGroup("EngPremisesAddress", english, rank),
                geo,
                parseScore(score));
    }

    private static JsonNode require(JsonNode node, int rank, String... path) {
        JsonNode current = node;
        StringBuilder walked = new StringBuilder();
        for (String key : path) {
            if (walked.length() > 0) walked.append('.');
            walked.append(key);
            if (current == null || !current.has(key)) {
                throw new MalformedSuggestionException(rank, "missing " + walked);
            }
            current = current.get(key);
        }
        return current;
    }

    private AddressNode.Group toGroup(String name, JsonNode object, int rank) {
        List<AddressNode> children = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            AddressNode child = toNode(field.getKey(), field.getValue(), rank);
            if (child != null) {
                children.add(child);
            }
        }
        return new AddressNode.Group(name, children);
    }

    private AddressNode toNode(String key, JsonNode value, int rank) {
        if (value.isNull()) {
            return null;
        }
        if ((CHI_STREET.equals(key) || CHI_VILLAGE.equals(key)) && value.isObject()) {
            return toStreetOrVillage(key, value, rank);
        }
        if (value.isObject()) {
            return toGroup(key, value, rank);
        }
        if (value.isTextual()) {
            return new AddressNode.Text(key, value.textValue());
        }
        return new AddressNode.Other(key, value.isValueNode() ? value.asText() : value.toString());
    }

    private AddressNode.StreetOrVillage toStreetOrVillage(String key, JsonNode value, int rank) {
        String streetName = textOrNull(value, AddressNode.StreetOrVillage.STREET_NAME);
        String villageName = textOrNull(value, AddressNode.StreetOrVillage.VILLAGE_NAME);
        if (streetName == null && villageName == null) {
            throw new MalformedSuggestionException(rank, key + " has neither StreetName nor VillageName");
        }
        return new AddressNode.StreetOrVillage(
                key,
                streetName,
                villageName,
                scalarOrNull(value, AddressNode.StreetOrVillage.BUILDING_NO_FROM),
                scalarOrNull(value, AddressNode.StreetOrVillage.BUILDING_NO_TO));
    }

    private static String textOrNull(JsonNode node, String key) {
        JsonNode value = node.get(key);
        return value != null && value.isTextual() ? value.textValue() : null;
    }

    private static String scalarOrNull(JsonNode node, String key) {
        JsonNode value = node.get(key);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }

    private static Double parseScore(JsonNode score) {
        if (score.isNumber()) {
            return score.doubleValue();
        }
        if (score.isTextual()) {
            try {
                return Double.parseDouble(score.textValue().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
