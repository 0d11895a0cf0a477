package com.eios.collab.room;

import com.eios.collab.client.DocumentClient;
import com.eios.collab.client.SceneGraphResponse;
import com.eios.collab.crdt.OperationJournal;
import com.eios.collab.crdt.ReplicatedDocument;
import com.eios.collab.crdt.SequencedOperation;
import com.eios.collab.error.TransientStorageException;
import com.eios.collab.persistence.PersistenceService;
import com.eios.collab.persistence.RestoredDocument;
import com.eios.collab.scenegraph.SceneGraphSeeder;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

import java.time.Clock;

/**
 * Brings a room's document into memory: from storage when it has history, otherwise
 * seeded from the platform's stored scene graph, otherwise the default scene graph.
 */
@ApplicationScoped
public class RoomLoader {

    private static final Logger LOG = Logger.getLogger(RoomLoader.class);

    private final PersistenceService persistence;
    private final DocumentClient documents;
    private final SceneGraphSeeder seeder;
    private final Clock clock;

    @Inject
    public RoomLoader(PersistenceService persistence, @RestClient DocumentClient documents,
                      SceneGraphSeeder seeder, Clock clock) {
        this.persistence = persistence;
        this.documents = documents;
        this.seeder = seeder;
        this.clock = clock;
    }

    /**
     * Loads the room if it is not loaded yet. Call under the room lock.
     */
    public void ensureLoaded(Room room) {
        if (room.isLoaded()) {
            return;
        }
        RestoredDocument restored = persistence.restore(room.id(), () -> seed(room.key()));
        OperationJournal journal = new OperationJournal(restored.snapshotWatermark());
        for (SequencedOperation op : restored.replayed()) {
            journal.record(op.sequence(), op.operation());
        }
        room.load(restored.document(), journal, clock.instant());
        if (restored.snapshot() == null) {
            room.requireSnapshot();
        }
        LOG.infof("Room %s loaded at watermark %d (%s)", room.id(), journal.watermark(),
            restored.fresh() ? "seeded" : restored.snapshot() == null ? "replayed from genesis" : "restored");
    }

    ReplicatedDocument seed(DocumentKey key) {
        try {
            SceneGraphResponse response = documents.getSceneGraph(key.siteId(), key.version());
            if (response == null || response.sceneGraph() == null || response.sceneGraph().isNull()) {
                return seeder.defaultDocument();
            }
            return seeder.seed(response.sceneGraph());
        } catch (WebApplicationException e) {
            if (e.getResponse().getStatus() == 404) {
                return seeder.defaultDocument();
            }
            throw new TransientStorageException("Scene graph of " + key + " could not be fetched", e);
        } catch (ProcessingException e) {
            throw new TransientStorageException("Scene graph of " + key + " could not be fetched", e);
        }
    }
}
