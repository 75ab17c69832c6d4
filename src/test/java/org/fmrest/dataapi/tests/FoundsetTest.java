package org.fmrest.dataapi.tests;

import org.fmrest.dataapi.model.DataInfo;
import org.fmrest.dataapi.rest.FieldCoercion;
import org.fmrest.dataapi.rest.Foundset;
import org.fmrest.dataapi.rest.Record;
import org.fmrest.dataapi.rest.interfaces.PageFetcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Paging rules of {@link Foundset} with an in-memory page source.
 */
public class FoundsetTest {

    /**
     * Serves pages out of a list of record ids and remembers the offsets asked for.
     */
    private static class ListPageFetcher implements PageFetcher {
        private final List<Long> ids;
        private final int pageSize;
        private final DataInfo dataInfo;
        private final List<Integer> requestedOffsets = new ArrayList<>();

        ListPageFetcher(int count, int pageSize, int foundCount) {
            this.ids = new ArrayList<>();
            for (long id = 1; id <= count; id++) {
                ids.add(id);
            }
            this.pageSize = pageSize;
            this.dataInfo = dataInfo(foundCount);
        }

        @Override
        public Foundset.Page fetch(int offset) {
            requestedOffsets.add(offset);
            int from = Math.min(offset - 1, ids.size());
            int to = Math.min(from + pageSize, ids.size());
            List<Record> records = ids.subList(from, to).stream()
                .map(FoundsetTest::record)
                .collect(Collectors.toList());
            return new Foundset.Page(records, dataInfo);
        }

        Foundset foundset(int startOffset) {
            Foundset.Page first = fetch(startOffset);
            requestedOffsets.clear();
            return new Foundset(first, startOffset, pageSize, this);
        }
    }

    private static Record record(long id) {
        return new Record("Contacts", id, 1, Map.of("name", "Contact " + id), Collections.emptyMap(),
            FieldCoercion.passThrough(), null);
    }

    private static DataInfo dataInfo(int foundCount) {
        DataInfo dataInfo = new DataInfo();
        dataInfo.setFoundCount(foundCount);
        dataInfo.setTotalRecordCount(foundCount);
        return dataInfo;
    }

    private static List<Long> ids(Iterable<Record> records) {
        List<Long> ids = new ArrayList<>();
        records.forEach(record -> ids.add(record.getRecordId()));
        return ids;
    }

    @Test
    @DisplayName("Pages requested at consecutive offsets until the found count")
    public void testPagesUntilFoundCount() {
        ListPageFetcher fetcher = new ListPageFetcher(5, 2, 5);
        Foundset foundset = fetcher.foundset(1);

        assertEquals(List.of(1L, 2L, 3L, 4L, 5L), ids(foundset));
        assertEquals(List.of(3, 5), fetcher.requestedOffsets);
        assertEquals(3, foundset.getPagesFetched());
        assertEquals(5, foundset.getFetchedCount());
    }

    @Test
    @DisplayName("Records beyond the found count are dropped")
    public void testTrimToFoundCount() {
        ListPageFetcher fetcher = new ListPageFetcher(10, 2, 3);
        Foundset foundset = fetcher.foundset(1);

        assertEquals(List.of(1L, 2L, 3L), ids(foundset));
        assertEquals(List.of(3), fetcher.requestedOffsets);
    }

    @Test
    @DisplayName("An empty page ends the foundset early")
    public void testEmptyPageStops() {
        ListPageFetcher fetcher = new ListPageFetcher(4, 2, 10);
        Foundset foundset = fetcher.foundset(1);

        assertEquals(4, foundset.toList().size());
        assertEquals(List.of(3, 5), fetcher.requestedOffsets);
        assertEquals(10, foundset.getTotalCount());
    }

    @Test
    @DisplayName("Start offset counts against the found count")
    public void testStartOffset() {
        ListPageFetcher fetcher = new ListPageFetcher(6, 2, 6);
        Foundset foundset = fetcher.foundset(4);

        assertEquals(List.of(4L, 5L, 6L), ids(foundset));
        assertEquals(List.of(6), fetcher.requestedOffsets);
    }

    @Test
    @DisplayName("Without dataInfo the first page is the whole foundset")
    public void testMissingDataInfo() {
        List<Record> records = List.of(record(1), record(2));
        Foundset foundset = new Foundset(new Foundset.Page(records, null), 1, 2, offset -> {
            throw new AssertionError("No further page expected");
        });

        assertEquals(2, foundset.getTotalCount());
        assertEquals(2, foundset.toList().size());
    }

    @Test
    @DisplayName("Empty foundset never fetches")
    public void testEmpty() {
        Foundset foundset = Foundset.empty(null);

        assertTrue(foundset.isEmpty());
        assertEquals(0, foundset.getTotalCount());
        assertEquals(0, foundset.stream().count());
        assertThrows(IndexOutOfBoundsException.class, () -> foundset.get(0));
    }

    @Test
    @DisplayName("Index and iterator bounds")
    public void testBounds() {
        Foundset foundset = new ListPageFetcher(3, 2, 3).foundset(1);

        assertThrows(IndexOutOfBoundsException.class, () -> foundset.get(-1));
        assertThrows(IndexOutOfBoundsException.class, () -> foundset.get(3));

        Iterator<Record> iterator = foundset.iterator();
        for (int i = 0; i < 3; i++) {
            assertTrue(iterator.hasNext());
            iterator.next();
        }
        assertFalse(iterator.hasNext());
        assertThrows(NoSuchElementException.class, iterator::next);
    }

    @Test
    @DisplayName("toList is a read-only snapshot and can be called repeatedly")
    public void testToList() {
        ListPageFetcher fetcher = new ListPageFetcher(3, 2, 3);
        Foundset foundset = fetcher.foundset(1);

        List<Record> first = foundset.toList();
        List<Record> second = foundset.toList();

        assertEquals(first, second);
        assertThrows(UnsupportedOperationException.class, () -> first.add(record(9)));
        assertEquals(List.of(3), fetcher.requestedOffsets, "Pages are fetched once");
    }
}
