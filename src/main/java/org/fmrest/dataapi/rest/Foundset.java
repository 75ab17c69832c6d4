package org.fmrest.dataapi.rest;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.fmrest.dataapi.model.DataInfo;
import org.fmrest.dataapi.rest.interfaces.PageFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Ordered result of a list or find request.
 * <p>
 * Holds the first page and pulls further pages through a {@link PageFetcher} only when an
 * index or iteration goes past what was fetched. Paging stops at the server's found count,
 * or on the first short or empty page.
 * </p>
 */
public class Foundset implements Iterable<Record> {

    private static final Logger logger = LoggerFactory.getLogger(Foundset.class);

    /**
     * One page of records with the counts reported next to it.
     */
    @Getter
    @AllArgsConstructor
    public static class Page {
        private final List<Record> records;
        private final DataInfo dataInfo;

        public static Page empty() {
            return new Page(Collections.emptyList(), null);
        }
    }

    /** Records fetched so far, in server order */
    private final List<Record> records = new ArrayList<>();
    private final DataInfo dataInfo;
    private final int pageSize;
    /** Callback for retrieving the next page */
    private final PageFetcher pageFetcher;
    /** Records available from the start offset to the end of the found set */
    private final int available;
    /** Offset of the next page to fetch */
    private int nextOffset;
    private boolean exhausted;
    private int pagesFetched;

    /**
     * @param firstPage   Page already returned by the server
     * @param startOffset 1-based offset the first page was requested at
     * @param pageSize    Limit each page was requested with
     * @param pageFetcher Fetches the page at a given offset
     */
    public Foundset(Page firstPage, int startOffset, int pageSize, PageFetcher pageFetcher) {
        this.dataInfo = firstPage.getDataInfo() != null ? firstPage.getDataInfo() : synthesize(firstPage.getRecords());
        this.pageSize = pageSize;
        this.pageFetcher = pageFetcher;
        this.available = Math.max(0, dataInfo.getFoundCount() - Math.max(startOffset, 1) + 1);
        this.nextOffset = Math.max(startOffset, 1);
        addPage(firstPage.getRecords());
    }

    /**
     * Found set without records, the result of a find that matched nothing.
     */
    public static Foundset empty(DataInfo dataInfo) {
        return new Foundset(new Page(Collections.emptyList(), dataInfo != null ? dataInfo : new DataInfo()),
                1, 0, offset -> Page.empty());
    }

    /**
     * Returns the record at the given position, fetching pages up to it when needed.
     *
     * @throws IndexOutOfBoundsException If the found set has fewer records
     */
    public Record get(int index) {
        if (index < 0) {
            throw new IndexOutOfBoundsException("Index: " + index);
        }
        while (index >= records.size() && !exhausted) {
            fetchNextPage();
        }
        if (index >= records.size()) {
            throw new IndexOutOfBoundsException("Index: " + index + ", Size: " + records.size());
        }
        return records.get(index);
    }

    public boolean isEmpty() {
        if (records.isEmpty() && !exhausted) {
            fetchNextPage();
        }
        return records.isEmpty();
    }

    /**
     * @return Number of records found by the request, which may exceed what was fetched so far
     */
    public int getTotalCount() {
        return dataInfo.getFoundCount();
    }

    /**
     * @return Number of records in the table behind the layout
     */
    public int getTotalRecordCount() {
        return dataInfo.getTotalRecordCount();
    }

    /**
     * @return Number of records fetched so far
     */
    public int getFetchedCount() {
        return records.size();
    }

    public int getPagesFetched() {
        return pagesFetched;
    }

    public DataInfo getDataInfo() {
        return dataInfo;
    }

    /**
     * Fetches every remaining page and returns all records.
     */
    public List<Record> toList() {
        while (!exhausted) {
            fetchNextPage();
        }
        return Collections.unmodifiableList(new ArrayList<>(records));
    }

    public Stream<Record> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    @Override
    public Iterator<Record> iterator() {
        return new Iterator<>() {
            private int index;

            @Override
            public boolean hasNext() {
                while (index >= records.size() && !exhausted) {
                    fetchNextPage();
                }
                return index < records.size();
            }

            @Override
            public Record next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return records.get(index++);
            }
        };
    }

    private void fetchNextPage() {
        logger.debug("Fetching page at offset {} (limit {})", nextOffset, pageSize);
        Page page = pageFetcher.fetch(nextOffset);
        addPage(page.getRecords());
    }

    private void addPage(List<Record> page) {
        pagesFetched++;
        int remaining = available - records.size();
        records.addAll(page.size() > remaining ? page.subList(0, Math.max(remaining, 0)) : page);
        nextOffset += page.size();

        if (page.isEmpty() || pageSize <= 0 || page.size() < pageSize || records.size() >= available) {
            exhausted = true;
        }
    }

    private static DataInfo synthesize(List<Record> records) {
        DataInfo info = new DataInfo();
        info.setFoundCount(records.size());
        info.setReturnedCount(records.size());
        info.setTotalRecordCount(records.size());
        return info;
    }

    @Override
    public String toString() {
        return "Foundset(totalCount=" + getTotalCount() + ", fetched=" + records.size() + ")";
    }
}
