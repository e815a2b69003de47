package org.github.zzf.realtime.client;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * outbound messages waiting for a connection.
 * <p>Priority entries go to the front, the others to the back. Once full the oldest non priority entry is dropped,
 * the oldest priority one if there is none.</p>
 * <p>Not thread safe, only touched by the client's event loop.</p>
 */
class PendingQueue {

    private final Deque<Entry> deque = new ArrayDeque<>();
    private final int capacity;

    PendingQueue(int capacity) {
        checkArgument(capacity > 0, "capacity");
        this.capacity = capacity;
    }

    /**
     * @return the dropped entry, null if nothing was dropped
     */
    Entry add(String text, boolean priority, String key) {
        Entry dropped = null;
        if (deque.size() >= capacity) {
            dropped = dropOldest();
        }
        Entry e = new Entry(text, priority, key);
        if (priority) {
            deque.addFirst(e);
        }
        else {
            deque.addLast(e);
        }
        return dropped;
    }

    private Entry dropOldest() {
        Iterator<Entry> it = deque.iterator();
        while (it.hasNext()) {
            Entry e = it.next();
            if (!e.priority) {
                it.remove();
                return e;
            }
        }
        // every entry is a priority one, the oldest sits at the tail
        return deque.pollLast();
    }

    /**
     * put back an entry that could not be sent
     */
    void addFirst(Entry e) {
        deque.addFirst(e);
    }

    Entry poll() {
        return deque.pollFirst();
    }

    boolean containsKey(String key) {
        for (Entry e : deque) {
            if (Objects.equals(key, e.key)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return how many entries carrying the key were removed
     */
    int removeKey(String key) {
        int removed = 0;
        Iterator<Entry> it = deque.iterator();
        while (it.hasNext()) {
            if (Objects.equals(key, it.next().key)) {
                it.remove();
                removed += 1;
            }
        }
        return removed;
    }

    int size() {
        return deque.size();
    }

    boolean isEmpty() {
        return deque.isEmpty();
    }

    /**
     * @return how many entries were discarded
     */
    int clear() {
        int size = deque.size();
        deque.clear();
        return size;
    }

    List<String> snapshot() {
        List<String> texts = new ArrayList<>(deque.size());
        for (Entry e : deque) {
            texts.add(e.text);
        }
        return texts;
    }

    static final class Entry {

        final String text;
        final boolean priority;
        /* dedup key, may be null */
        final String key;

        Entry(String text, boolean priority, String key) {
            this.text = text;
            this.priority = priority;
            this.key = key;
        }

        @Override
        public String toString() {
            final StringBuilder sb = new StringBuilder("{");
            sb.append("\"priority\":").append(priority).append(',');
            if (key != null) {
                sb.append("\"key\":\"").append(key).append('\"').append(',');
            }
            sb.append("\"text\":").append(text).append(',');
            return sb.replace(sb.length() - 1, sb.length(), "}").toString();
        }

    }

}
