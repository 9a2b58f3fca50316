package com.storeshots.service.batch;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe, append-only record of per-file outcomes keyed by locale and file name. A file
 * can be recorded once; a second record for the same key is a programming error.
 */
public class ResultLedger {

    private final Map<Key, ProcessingResult> results = new ConcurrentHashMap<>();

    public void record(ProcessingResult result) {
        ProcessingResult previous = results.putIfAbsent(new Key(result.locale(), result.fileName()), result);
        if (previous != null) {
            throw new IllegalStateException("Outcome for " + result.locale() + "/" + result.fileName()
                    + " already recorded as " + previous.status());
        }
    }

    public boolean contains(String locale, String fileName) {
        return results.containsKey(new Key(locale, fileName));
    }

    public int size() {
        return results.size();
    }

    public List<ProcessingResult> results() {
        return results.values().stream()
                .sorted(Comparator.comparing(ProcessingResult::locale).thenComparing(ProcessingResult::fileName))
                .toList();
    }

    private record Key(String locale, String fileName) {
    }
}
