package com.arenasync.reconcile;

import java.io.Closeable;
import java.io.IOException;

public interface EventSink extends Closeable {
    void record(SourceEvent event) throws IOException;
}
