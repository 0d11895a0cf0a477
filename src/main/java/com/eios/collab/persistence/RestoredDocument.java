package com.eios.collab.persistence;

import com.eios.collab.crdt.ReplicatedDocument;
import com.eios.collab.crdt.SequencedOperation;

import java.util.List;

/**
 * A document rebuilt from storage.
 *
 * @param snapshotWatermark watermark of the snapshot the document started from, 0 when
 *                          rebuilt from genesis
 * @param replayed          logged operations after that watermark, already merged
 * @param snapshot          the snapshot used, {@code null} when rebuilt from genesis
 * @param fresh             nothing was stored for this document
 */
public record RestoredDocument(
    ReplicatedDocument document,
    long snapshotWatermark,
    List<SequencedOperation> replayed,
    SnapshotInfo snapshot,
    boolean fresh
) {}
