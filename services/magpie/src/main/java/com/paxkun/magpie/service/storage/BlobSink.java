package com.paxkun.magpie.service.storage;

import com.paxkun.magpie.exception.StoreException;

/**
 * Where processed images end up. Implementations must accept concurrent puts for
 * distinct keys.
 */
public interface BlobSink {

    /**
     * @param key relative key such as {@code sunset/1718000000000_1a2b3c4d_1.jpg}
     * @return public URL of the stored object
     * @throws StoreException when the write fails
     */
    String put(String key, byte[] bytes, String contentType);

    /**
     * Best-effort removal.
     *
     * @return true when an object was removed
     */
    boolean delete(String key);
}
