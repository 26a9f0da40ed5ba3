package com.address.resolution.ogcio;

import com.address.resolution.core.model.AddressNode;
import com.address.resolution.core.model.Candidate;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CandidateFlattenerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final CandidateFlattener flattener = new CandidateFlattener();

    private static JsonNode fixture() throws Exception {
        try (InputStream in = CandidateFlattenerTest.class.getResourceAsStream("/ogcio/queens-road-central.json")) {
            return MAPPER.readTree(in).get("SuggestedAddress");
        }
    }

    private static JsonNode suggestion(String chinese, String score) throws Exception {
        return MAPPER.readTree("""
                {"Address": {"PremisesAddress": {
                    "ChiPremisesAddress": %s,
                    "EngPremisesAddress": {"Region": "HK"},
                    "GeospatialInformation": {"Latitude": "22.3"}}},
                 "ValidationInformation": {"Score": %s}}
                """.formatted(chinese, score));
    }

    @Nested
    @DisplayName("Well-formed suggestions")
    class WellFormedTests {

        @Test
        @DisplayName("Should flatten the provider document into a typed tree")
        void testFlattenFixture() throws Exception {
            List<Candidate> candidates = flattener.flatten(fixture());

            assertEquals(1, candidates.size());
            Candidate candidate = candidates.get(0);
            assertEquals(0, candidate.rank());
            assertEquals(72.5, candidate.providerScore());
            assertEquals("22.2829", candidate.geo().get("Latitude").asText());

            AddressNode.Group chinese = candidate.chineseFields();
            assertEquals(List.of("BuildingName", "ChiStreet", "ChiDistrict", "Region"),
                    chinese.children().stream().map(AddressNode::name).toList());

            AddressNode street = chinese.child("ChiStreet").orElseThrow();
            AddressNode.StreetOrVillage typed = assertInstanceOf(AddressNode.StreetOrVillage.class, street);
            assertEquals("皇后大道中", typed.streetName());
            assertEquals("95", typed.buildingNoFrom());
            assertEquals("101", typed.buildingNoTo());

            assertEquals(Optional.of("中西區"), chinese.find(List.of("ChiDistrict", "DcDistrict")));
            assertEquals(Optional.of("QUEEN'S ROAD CENTRAL"),
                    candidate.englishFields().find(List.of("EngStreet", "StreetName")));
        }

        @Test
        @DisplayName("Rank follows provider order")
        void testRanks() throws Exception {
            ArrayNode array = MAPPER.createArrayNode();
            array.add(suggestion("{\"Region\": \"香港\"}", "90"));
            array.add(suggestion("{\"Region\": \"九龍\"}", "80"));

            List<Candidate> candidates = flattener.flatten(array);

            assertEquals(0, candidates.get(0).rank());
            assertEquals(1, candidates.get(1).rank());
            assertEquals(Optional.of("九龍"), candidates.get(1).chineseFields().find(List.of("Region")));
        }

        @Test
        @DisplayName("ChiVillage becomes a street-or-village node")
        void testVillage() throws Exception {
            JsonNode node = suggestion("{\"ChiVillage\": {\"VillageName\": \"錦田村\", \"BuildingNoFrom\": \"12\"}}", "60");

            Candidate candidate = flattener.flatten(MAPPER.createArrayNode().add(node)).get(0);

            AddressNode.StreetOrVillage village = assertInstanceOf(AddressNode.StreetOrVillage.class,
                    candidate.chineseFields().child("ChiVillage").orElseThrow());
            assertEquals("VillageName", village.nameKey());
            assertEquals("12", village.buildingNoFrom());
            assertNull(village.buildingNoTo());
        }

        @Test
        @DisplayName("Non-text leaves are kept aside and nulls are skipped")
        void testOtherLeaves() throws Exception {
            JsonNode node = suggestion("{\"Region\": \"香港\", \"Floor\": 3, \"BuildingName\": null}", "60");

            Candidate candidate = flattener.flatten(MAPPER.createArrayNode().add(node)).get(0);

            assertInstanceOf(AddressNode.Other.class, candidate.chineseFields().child("Floor").orElseThrow());
            assertTrue(candidate.chineseFields().child("BuildingName").isEmpty());
        }

        @Test
        @DisplayName("Score may arrive as text or be unusable")
        void testScoreShapes() throws Exception {
            Candidate text = flattener.flattenOne(suggestion("{}", "\"68.9\""), 0);
            Candidate junk = flattener.flattenOne(suggestion("{}", "\"n/a\""), 0);
            Candidate missing = flattener.flattenOne(suggestion("{}", "null"), 0);

            assertEquals(68.9, text.providerScore());
            assertNull(junk.providerScore());
            assertNull(missing.providerScore());
        }
    }

    @Nested
    @DisplayName("Malformed suggestions")
    class MalformedTests {

        @Test
        @DisplayName("Missing premises address is rejected with its rank")
        void testMissingPath() throws Exception {
            ArrayNode array = MAPPER.createArrayNode();
            array.add(suggestion("{}", "90"));
            array.add(MAPPER.readTree("{\"Address\": {}, \"ValidationInformation\": {\"Score\": 1}}"));

            MalformedSuggestionException e = assertThrows(MalformedSuggestionException.class,
                    () -> flattener.flatten(array));
            assertEquals(1, e.getRank());
            assertTrue(e.getMessage().contains("Address.PremisesAddress"));
        }

        @Test
        @DisplayName("Missing validation score is rejected")
        void testMissingScore() throws Exception {
            JsonNode node = MAPPER.readTree("""
                    {"Address": {"PremisesAddress": {
                        "ChiPremisesAddress": {}, "EngPremisesAddress": {}, "GeospatialInformation": {}}}}
                    """);
            assertThrows(MalformedSuggestionException.class, () -> flattener.flattenOne(node, 0));
        }

        @Test
        @DisplayName("Street without a name is rejected")
        void testNamelessStreet() throws Exception {
            JsonNode node = suggestion("{\"ChiStreet\": {\"BuildingNoFrom\": \"1\"}}", "50");
            assertThrows(MalformedSuggestionException.class, () -> flattener.flattenOne(node, 0));
        }

        @Test
        @DisplayName("Input must be an array")
        void testNotArray() {
            assertThrows(MalformedSuggestionException.class, () -> flattener.flatten(MAPPER.createObjectNode()));
            assertThrows(MalformedSuggestionException.class, () -> flattener.flatten(null));
        }
    }
}
