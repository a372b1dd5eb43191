package com.pagechains.analytics.chains;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import com.pagechains.analytics.model.Initiator;
import com.pagechains.analytics.model.InitiatorType;
import com.pagechains.analytics.model.RequestRecord;
import com.pagechains.analytics.model.ResourceType;
import com.pagechains.analytics.parse.PageEventParsers;
import com.pagechains.analytics.util.JsonSupport;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.pagechains.analytics.model.RequestPriority.HIGH;
import static com.pagechains.analytics.model.RequestPriority.LOW;
import static com.pagechains.analytics.model.RequestPriority.MEDIUM;
import static com.pagechains.analytics.model.RequestPriority.UNKNOWN;
import static com.pagechains.analytics.model.RequestPriority.VERY_HIGH;
import static com.pagechains.analytics.model.RequestPriority.VERY_LOW;
import static org.junit.jupiter.api.Assertions.*;

class CriticalChainAssemblerTest {

    private final CriticalChainAssembler assembler = new CriticalChainAssembler(MockRecords.rules());

    @Test
    void buildsLinearChainOfCriticalRequests() {
        List<RequestRecord> records = MockRecords.build(
                List.of(HIGH, MEDIUM, VERY_HIGH, HIGH),
                new int[][] {{0, 1}, {1, 2}, {2, 3}});

        ChainForest forest = assembler.assemble(records, MockRecords.root());

        assertEquals(List.of("0", "1", "2", "3"), new ArrayList<>(forest.requestIds()));
        assertEquals(Map.of("1", "0", "2", "1", "3", "2"), forest.parentById());
        assertTrue(forest.root().child("1").child("2").child("3").isLeaf());
    }

    @Test
    void lowPriorityRequestCutsOffEverythingBelowIt() {
        List<RequestRecord> records = MockRecords.build(
                List.of(MEDIUM, HIGH, LOW, MEDIUM, HIGH, VERY_LOW),
                new int[][] {{0, 1}, {1, 2}, {2, 3}, {3, 4}});

        ChainForest forest = assembler.assemble(records, MockRecords.root());

        assertEquals(List.of("0", "1"), new ArrayList<>(forest.requestIds()));
        assertTrue(forest.root().child("1").isLeaf());
    }

    @Test
    void requestsNotReachableFromRootAreDropped() {
        List<RequestRecord> records = MockRecords.build(
                List.of(HIGH, HIGH, HIGH, HIGH),
                new int[][] {{0, 2}, {1, 3}});

        ChainForest forest = assembler.assemble(records, MockRecords.root());

        assertEquals(List.of("0", "2"), new ArrayList<>(forest.requestIds()));
        assertEquals(Collections.singleton("2"), forest.root().children().keySet());
    }

    @Test
    void forksBelowTheRoot() {
        List<RequestRecord> records = MockRecords.build(
                List.of(HIGH, HIGH, HIGH, HIGH),
                new int[][] {{0, 1}, {1, 2}, {1, 3}});

        ChainForest forest = assembler.assemble(records, MockRecords.root());

        ChainNode fork = forest.root().child("1");
        assertEquals(List.of("2", "3"), new ArrayList<>(fork.children().keySet()));
        assertTrue(fork.child("2").isLeaf());
        assertTrue(fork.child("3").isLeaf());
    }

    @Test
    void rootAloneWhenNothingElseIsCritical() {
        List<RequestRecord> records = MockRecords.build(
                List.of(VERY_HIGH, LOW),
                new int[][] {{0, 1}});

        ChainForest forest = assembler.assemble(records, MockRecords.root());

        assertEquals(1, forest.nodeCount());
        assertEquals("0", forest.root().requestId());
        assertTrue(forest.root().isLeaf());
    }

    @Test
    void buildsBranchingGraph() {
        List<RequestRecord> records = MockRecords.build(
                Collections.nCopies(9, HIGH),
                new int[][] {{0, 1}, {1, 2}, {1, 3}, {0, 4}, {4, 5}, {5, 7}, {7, 8}, {5, 6}});

        ChainForest forest = assembler.assemble(records, MockRecords.root());

        Map<String, String> expected = new HashMap<>();
        expected.put("1", "0");
        expected.put("2", "1");
        expected.put("3", "1");
        expected.put("4", "0");
        expected.put("5", "4");
        expected.put("6", "5");
        expected.put("7", "5");
        expected.put("8", "7");
        assertEquals(expected, forest.parentById());
        assertEquals(List.of("0", "1", "2", "3", "4", "5", "6", "7", "8"), new ArrayList<>(forest.requestIds()));
    }

    @Test
    void faviconsAreNeverCritical() {
        List<RequestRecord> records = MockRecords.build(
                List.of(HIGH, HIGH, HIGH, HIGH),
                new int[][] {{0, 1}, {0, 2}, {0, 3}});
        favicon(records.get(1), "favicon.ico", "image/x-icon");
        favicon(records.get(2), "favicon-32x32.png", "image/png");
        favicon(records.get(3), "android-chrome-192x192.png", "image/png");

        ChainForest forest = assembler.assemble(records, MockRecords.root());

        assertTrue(forest.root().isLeaf());
    }

    @Test
    void subFrameDocumentsAndTheirRedirectsAreExcluded() {
        List<RequestRecord> records = MockRecords.build(
                List.of(HIGH, HIGH, HIGH, UNKNOWN, LOW),
                new int[][] {{0, 1}, {0, 2}, {0, 3}});
        records.get(1).resourceType = ResourceType.DOCUMENT;
        records.get(1).frameId = "2";
        records.get(2).resourceType = ResourceType.DOCUMENT;
        records.get(2).frameId = "3";
        records.get(3).resourceType = ResourceType.UNKNOWN;
        records.get(3).statusCode = 302;
        records.get(3).redirectDestination = "4";
        records.get(4).resourceType = ResourceType.DOCUMENT;
        records.get(4).frameId = "4";

        ChainForest forest = assembler.assemble(records, MockRecords.root());

        assertTrue(forest.root().isLeaf());
        assertEquals(1, forest.nodeCount());
    }

    @Test
    void resultDoesNotDependOnInputOrder() {
        List<RequestRecord> forward = MockRecords.build(
                Collections.nCopies(9, HIGH),
                new int[][] {{0, 1}, {1, 2}, {1, 3}, {0, 4}, {4, 5}, {5, 7}, {7, 8}, {5, 6}});
        List<RequestRecord> reversed = new ArrayList<>(forward);
        Collections.reverse(reversed);

        String expected = ForestSerializer.toJson(assembler.assemble(forward, MockRecords.root()));
        String actual = ForestSerializer.toJson(assembler.assemble(reversed, MockRecords.root()));

        assertEquals(expected, actual);
    }

    @Test
    void mainDocumentTieOnUrlAndStartPicksLowestRequestId() {
        List<RequestRecord> forward = MockRecords.build(List.of(HIGH, HIGH), new int[][] {{0, 1}});
        forward.get(1).initiator.requestId = "0";
        RequestRecord twin = MockRecords.record(9, ResourceType.DOCUMENT, HIGH);
        twin.url = MockRecords.url(0);
        twin.startTime = 0.0;
        twin.responseReceivedTime = 0.5;
        twin.endTime = 1.0;
        forward.add(twin);
        List<RequestRecord> reversed = new ArrayList<>(forward);
        Collections.reverse(reversed);

        ChainForest fromForward = assembler.assemble(forward, MockRecords.root());
        ChainForest fromReversed = assembler.assemble(reversed, MockRecords.root());

        assertEquals("0", fromForward.root().requestId());
        assertEquals("0", fromReversed.root().requestId());
        assertEquals(List.of("0", "1"), new ArrayList<>(fromReversed.requestIds()));
        assertEquals(ForestSerializer.toJson(fromForward), ForestSerializer.toJson(fromReversed));
    }

    @Test
    void faviconNamedStylesheetIsExcludedWithItsChildren() {
        List<RequestRecord> records = MockRecords.build(
                List.of(HIGH, HIGH, HIGH, HIGH),
                new int[][] {{0, 1}, {1, 2}, {0, 3}});
        records.get(1).url = MockRecords.BASE_URL + "favicon.ico";
        records.get(2).initiator.url = records.get(1).url;

        ChainForest forest = assembler.assemble(records, MockRecords.root());

        assertEquals(ResourceType.STYLESHEET, records.get(1).resourceType);
        assertNull(records.get(1).mimeType);
        assertFalse(forest.requestIds().contains("1"));
        assertFalse(forest.requestIds().contains("2"));
        assertEquals(List.of("0", "3"), new ArrayList<>(forest.requestIds()));
    }

    @Test
    void lowPriorityRootStaysRoot() {
        List<RequestRecord> records = MockRecords.build(
                List.of(VERY_LOW, HIGH, VERY_HIGH),
                new int[][] {{0, 1}, {1, 2}});

        ChainForest forest = assembler.assemble(records, MockRecords.root());

        assertEquals("0", forest.root().requestId());
        assertEquals(List.of("0", "1", "2"), new ArrayList<>(forest.requestIds()));
    }

    @Test
    void reserializingTheSameForestIsStable() throws Exception {
        ChainForest forest = assembler.assemble(
                MockRecords.build(List.of(HIGH, HIGH, MEDIUM), new int[][] {{0, 1}, {0, 2}}),
                MockRecords.root());

        String first = ForestSerializer.toJson(forest);
        String second = ForestSerializer.toJson(forest);

        assertEquals(first, second);
        assertEquals(first, JsonSupport.MAPPER.writeValueAsString(JsonSupport.MAPPER.readTree(first)));
    }

    @Test
    void linkPreloadsAreNotCritical() {
        List<RequestRecord> records = MockRecords.build(List.of(HIGH, HIGH), new int[][] {{0, 1}});
        records.get(1).isLinkPreload = true;

        ChainForest forest = assembler.assemble(records, MockRecords.root());

        assertTrue(forest.root().isLeaf());
    }

    @Test
    void emptyInputGivesEmptyForest() {
        ChainForest forest = assembler.assemble(Collections.emptyList(), MockRecords.root());

        assertTrue(forest.isEmpty());
        assertNull(forest.root());
        assertEquals(0, forest.nodeCount());
        assertTrue(forest.roots().isEmpty());
    }

    @Test
    void duplicateRequestIdsAreRejected() {
        List<RequestRecord> records = MockRecords.build(List.of(HIGH, HIGH), new int[][] {{0, 1}});
        records.get(1).requestId = "0";

        MalformedNetworkRecordsException ex = assertThrows(MalformedNetworkRecordsException.class,
                () -> assembler.assemble(records, MockRecords.root()));
        assertEquals(MalformedNetworkRecordsException.Reason.DUPLICATE_REQUEST_ID, ex.reason());
    }

    @Test
    void missingRootDocumentIsRejected() {
        List<RequestRecord> records = MockRecords.build(List.of(HIGH, HIGH), new int[][] {{0, 1}});

        MalformedNetworkRecordsException ex = assertThrows(MalformedNetworkRecordsException.class,
                () -> assembler.assemble(records, RootDocument.ofUrl("https://elsewhere.example/")));
        assertEquals(MalformedNetworkRecordsException.Reason.ROOT_NOT_FOUND, ex.reason());
        assertEquals("root_not_found", ex.reason().code());
    }

    @Test
    void rootWithResolvableInitiatorIsRejected() {
        List<RequestRecord> records = MockRecords.build(List.of(HIGH, HIGH), new int[][] {{0, 1}});
        records.get(1).resourceType = ResourceType.DOCUMENT;

        MalformedNetworkRecordsException ex = assertThrows(MalformedNetworkRecordsException.class,
                () -> assembler.assemble(records, RootDocument.ofRequestId("1")));
        assertEquals(MalformedNetworkRecordsException.Reason.ROOT_HAS_INITIATOR, ex.reason());
    }

    @Test
    void redirectCycleIsRejected() {
        List<RequestRecord> records = MockRecords.build(List.of(HIGH, HIGH, HIGH), new int[][] {{0, 1}});
        records.get(1).redirectDestination = "2";
        records.get(2).redirectDestination = "1";

        MalformedNetworkRecordsException ex = assertThrows(MalformedNetworkRecordsException.class,
                () -> assembler.assemble(records, MockRecords.root()));
        assertEquals(MalformedNetworkRecordsException.Reason.REDIRECT_CYCLE, ex.reason());
    }

    @Test
    void redirectedMainDocumentIsRootedAtFirstHop() {
        RequestRecord hop = MockRecords.record(0, ResourceType.DOCUMENT, VERY_HIGH);
        hop.url = "http://example.com/";
        hop.statusCode = 301;
        hop.redirectDestination = "1";
        RequestRecord document = MockRecords.record(1, ResourceType.DOCUMENT, VERY_HIGH);
        RequestRecord stylesheet = MockRecords.initiatedBy(MockRecords.record(2, ResourceType.STYLESHEET, HIGH), 1);

        ChainForest forest = assembler.assemble(
                Arrays.asList(stylesheet, document, hop), RootDocument.ofUrl(MockRecords.url(1)));

        assertEquals("0", forest.root().requestId());
        assertEquals(List.of("0", "1", "2"), new ArrayList<>(forest.requestIds()));
        assertEquals(Map.of("1", "0", "2", "1"), forest.parentById());
    }

    @Test
    void dependentsOfRedirectedRequestAttachUnderFinalHop() {
        RequestRecord document = MockRecords.record(0, ResourceType.DOCUMENT, VERY_HIGH);
        RequestRecord movedStylesheet = MockRecords.initiatedBy(
                MockRecords.record(1, ResourceType.UNKNOWN, UNKNOWN), 0);
        movedStylesheet.statusCode = 302;
        movedStylesheet.redirectDestination = "2";
        RequestRecord stylesheet = MockRecords.record(2, ResourceType.STYLESHEET, HIGH);
        RequestRecord viaFinalUrl = MockRecords.initiatedBy(MockRecords.record(3, ResourceType.STYLESHEET, HIGH), 2);
        RequestRecord viaFirstUrl = MockRecords.initiatedBy(MockRecords.record(4, ResourceType.STYLESHEET, HIGH), 1);

        ChainForest forest = assembler.assemble(
                List.of(document, movedStylesheet, stylesheet, viaFinalUrl, viaFirstUrl), MockRecords.root());

        ChainNode finalHop = forest.root().child("1").child("2");
        assertNotNull(finalHop);
        assertEquals(List.of("3", "4"), new ArrayList<>(finalHop.children().keySet()));
    }

    @Test
    void scriptInitiatedFetchIsNotCritical() {
        List<RequestRecord> records = MockRecords.build(List.of(HIGH, HIGH, HIGH), new int[][] {{0, 1}, {0, 2}});
        records.get(1).resourceType = ResourceType.FETCH;
        records.get(2).resourceType = ResourceType.FETCH;
        records.get(2).initiator = new Initiator(InitiatorType.SCRIPT, MockRecords.url(0));

        ChainForest forest = assembler.assemble(records, MockRecords.root());

        assertEquals(List.of("0", "1"), new ArrayList<>(forest.requestIds()));
    }

    @Test
    void assemblesRecordedPageLoadFixture() throws Exception {
        JsonNode fixture;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("fixtures/page_load_records.json")) {
            assertNotNull(in, "fixture missing from test classpath");
            fixture = JsonSupport.MAPPER.readTree(in);
        }
        List<RequestRecord> records = new ArrayList<>();
        for (JsonNode node : fixture.path("records")) {
            records.add(PageEventParsers.toRequestRecord(node));
        }

        ChainForest forest = assembler.assemble(
                records, RootDocument.ofUrl(fixture.path("main_document_url").asText()));

        List<String> expected = new ArrayList<>();
        for (JsonNode id : fixture.path("expected_critical_ids")) {
            expected.add(id.asText());
        }
        assertEquals(expected, new ArrayList<>(forest.requestIds()));
    }

    private static void favicon(RequestRecord record, String fileName, String mimeType) {
        record.url = MockRecords.BASE_URL + fileName;
        record.resourceType = ResourceType.IMAGE;
        record.mimeType = mimeType;
    }
}
