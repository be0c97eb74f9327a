package com.opsdata.reconciliation.client;

import com.opsdata.reconciliation.domain.SourceKind;

public interface SourceRowReader {

    SourceExport read(SourceKind kind);

    String location(SourceKind kind);

    String format(SourceKind kind);
}
