package com.arenasync.reconcile;

import java.io.IOException;

import com.arenasync.source.SourceKey;

public interface Reconciler {
    ReconcileResult reconcile(SourceKey key) throws IOException;
}
