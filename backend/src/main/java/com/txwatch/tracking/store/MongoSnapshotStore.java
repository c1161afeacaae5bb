package com.txwatch.tracking.store;

import com.mongodb.client.gridfs.model.GridFSFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.gridfs.GridFsTemplate;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.Date;
import java.util.Optional;

import static org.springframework.data.mongodb.gridfs.GridFsCriteria.whereFilename;

/**
 * {@link SnapshotStore} on a GridFS bucket ({@code snapshots} by default), one file per key.
 * Values are chunked, so a snapshot may exceed the 16MB BSON document limit.
 * A write stores the new file first and then drops older files of the same key.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MongoSnapshotStore implements SnapshotStore {

    static final String CONTENT_TYPE = "application/json";

    private final GridFsTemplate gridFsTemplate;
    private final Clock clock;

    @Override
    public Optional<byte[]> get(String key) {
        GridFSFile file = gridFsTemplate
                .find(Query.query(whereFilename().is(key)).with(Sort.by(Sort.Direction.DESC, "uploadDate", "_id")))
                .first();
        if (file == null) {
            return Optional.empty();
        }
        try (InputStream in = gridFsTemplate.getResource(file).getInputStream()) {
            return Optional.of(in.readAllBytes());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read snapshot " + key, e);
        }
    }

    @Override
    public void set(String key, byte[] value) {
        Document metadata = new Document("sizeBytes", value.length)
                .append("updatedAt", Date.from(clock.instant()));
        ObjectId id = gridFsTemplate.store(new ByteArrayInputStream(value), key, CONTENT_TYPE, metadata);
        gridFsTemplate.delete(Query.query(whereFilename().is(key)).addCriteria(Criteria.where("_id").ne(id)));
        log.debug("Snapshot saved: key={} bytes={} file={}", key, value.length, id);
    }
}
