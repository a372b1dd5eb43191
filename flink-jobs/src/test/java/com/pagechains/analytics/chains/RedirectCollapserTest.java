package com.pagechains.analytics.chains;

import org.junit.jupiter.api.Test;

import com.pagechains.analytics.model.RequestPriority;
import com.pagechains.analytics.model.RequestRecord;
import com.pagechains.analytics.model.ResourceType;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RedirectCollapserTest {

    @Test
    void followsRedirectsRegardlessOfInputOrder() {
        RequestRecord first = hop(0, "1");
        RequestRecord second = hop(1, "2");
        RequestRecord last = hop(2, null);
        RequestRecord unrelated = hop(3, null);

        RedirectChains chains = RedirectCollapser.collapse(RequestRegistry.index(List.of(last, unrelated, second, first)));

        RedirectChain chain = chains.chainOf("1");
        assertSame(first, chain.head());
        assertSame(last, chain.terminal());
        assertEquals(3, chain.size());
        assertTrue(chain.isRedirected());
        assertTrue(chain.isTerminal(last));
        assertFalse(chain.isTerminal(second));
        assertSame(chain, chains.chainOf("0"));
        assertSame(chain, chains.chainOf("2"));
        assertEquals(Set.of("0", "1", "2"), chain.requestIds());
        assertFalse(chains.chainOf("3").isRedirected());
        assertEquals(2, chains.chains().size());
    }

    @Test
    void destinationOutsideThePageLoadEndsTheChain() {
        RequestRecord record = hop(0, "missing");

        RedirectChain chain = RedirectCollapser.collapse(RequestRegistry.index(List.of(record))).chainOf("0");

        assertEquals(1, chain.size());
        assertSame(record, chain.terminal());
    }

    @Test
    void selfRedirectIsRejected() {
        MalformedNetworkRecordsException ex = assertThrows(MalformedNetworkRecordsException.class,
                () -> RequestRegistry.index(List.of(hop(0, "0"))));
        assertEquals(MalformedNetworkRecordsException.Reason.REDIRECT_CYCLE, ex.reason());
    }

    @Test
    void twoHopsClaimingOneDestinationAreRejected() {
        MalformedNetworkRecordsException ex = assertThrows(MalformedNetworkRecordsException.class,
                () -> RequestRegistry.index(List.of(hop(0, "2"), hop(1, "2"), hop(2, null))));
        assertEquals(MalformedNetworkRecordsException.Reason.REDIRECT_DESTINATION_CLAIMED, ex.reason());
    }

    @Test
    void loopWithoutHeadIsRejected() {
        RequestRegistry registry = RequestRegistry.index(List.of(hop(0, "1"), hop(1, "2"), hop(2, "0")));

        MalformedNetworkRecordsException ex = assertThrows(MalformedNetworkRecordsException.class,
                () -> RedirectCollapser.collapse(registry));
        assertEquals(MalformedNetworkRecordsException.Reason.REDIRECT_CYCLE, ex.reason());
    }

    private static RequestRecord hop(int index, String destination) {
        RequestRecord record = MockRecords.record(index, ResourceType.DOCUMENT, RequestPriority.HIGH);
        record.redirectDestination = destination;
        return record;
    }
}
