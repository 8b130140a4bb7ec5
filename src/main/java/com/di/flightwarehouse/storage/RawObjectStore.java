package com.di.flightwarehouse.storage;

import java.io.Reader;
import java.nio.file.Path;
import java.util.List;

/**
 * Object storage holding the raw fact and reference files.
 * <p>
 * Readers are streamed; callers close them. Implementations must never buffer a whole object in memory.
 */
public interface RawObjectStore {

    /** Creates the bucket if it does not exist yet. */
    void ensureBucket(String bucket);

    /** Uploads a local file under {@code key}, replacing any existing object. */
    void upload(String bucket, String key, Path file);

    /** Lists object keys under {@code prefix}, in no particular order. */
    List<String> list(String bucket, String prefix);

    /** Opens a UTF-8 character stream over the object. */
    Reader openReader(String bucket, String key);
}
