package gitclone.core.transport;

import gitclone.exceptions.GitException;

/**
 * The two round trips of a clone: ref discovery and pack retrieval.
 */
public interface Transport {
    /**
     * Ask the remote which refs it has
     */
    RefAdvertisement discoverRefs() throws GitException;

    /**
     * Send the want list and return the raw pack stream, acknowledgement
     * lines already stripped
     */
    byte[] fetchPack(UploadPackRequest request) throws GitException;
}
