package gitclone.core.refs;

import gitclone.exceptions.RepositoryException;

public interface RefStore {
    /**
     * Persist a ref, replacing any previous value
     */
    void writeRef(Ref ref) throws RepositoryException;

    /**
     * Read a ref exactly as stored, without following symbolic targets
     *
     * @throws gitclone.exceptions.RefNotFoundException if the ref does not exist
     */
    Ref readRef(String name) throws RepositoryException;

    /**
     * Resolve a ref to an object id, following one level of symbolic
     * indirection
     */
    String resolve(String name) throws RepositoryException;

    /**
     * Resolve HEAD to a commit id
     */
    default String resolveHead() throws RepositoryException {
        return resolve(Ref.HEAD);
    }
}
