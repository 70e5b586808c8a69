package gitclone.core.clone;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gitclone.config.ClientConfig;
import gitclone.core.checkout.CheckoutMaterializer;
import gitclone.core.checkout.CheckoutResult;
import gitclone.core.pack.PackParseResult;
import gitclone.core.pack.PackParser;
import gitclone.core.refs.Ref;
import gitclone.core.repository.GitRepository;
import gitclone.core.transport.AdvertisedRef;
import gitclone.core.transport.RefAdvertisement;
import gitclone.core.transport.SmartHttpTransport;
import gitclone.core.transport.Transport;
import gitclone.core.transport.UploadPackRequest;
import gitclone.exceptions.GitException;
import gitclone.exceptions.RepositoryException;
import gitclone.utils.io.FileUtils;

/**
 * Full clone of an anonymous smart-HTTP remote into a new directory.
 *
 * Steps run strictly in order and nothing is retried or rolled back: a
 * failure leaves whatever was already written in place, and running the clone
 * again into a fresh directory is the way to recover.
 *
 * 1. initialize .git layout
 * 2. discover refs and persist them (HEAD symbolic when advertised)
 * 3. want every distinct advertised id, receive the pack
 * 4. decode the pack into the object store
 * 5. check out HEAD
 */
public class CloneOperation {
    private static final Logger logger = LoggerFactory.getLogger(CloneOperation.class);

    private static final String BRANCH_PREFIX = "refs/heads/";
    private static final List<String> DEFAULT_BRANCHES = List.of(BRANCH_PREFIX + "main", BRANCH_PREFIX + "master");

    private final ClientConfig config;

    public CloneOperation(ClientConfig config) {
        this.config = config;
    }

    public CloneResult run(String url, Path directory) throws GitException {
        CloneResult result = run(new SmartHttpTransport(url, config), directory);
        result.getRepository().addRemote("origin", url);
        return result;
    }

    public CloneResult run(Transport transport, Path directory) throws GitException {
        ensureUsableTarget(directory);

        GitRepository repository = new GitRepository();
        repository.init(directory);

        RefAdvertisement advertisement = transport.discoverRefs();
        List<Ref> refs = advertisement.toLocalRefs();
        if (advertisement.isEmpty()) {
            logger.warn("You appear to have cloned an empty repository");
            return new CloneResult(repository, refs, null, null);
        }

        for (Ref ref : refs) {
            repository.getRefStore().writeRef(ref);
        }
        boolean hasHead = advertisement.findRef(Ref.HEAD).isPresent();
        if (!hasHead) {
            hasHead = pointHeadAtDefaultBranch(repository, advertisement);
        }

        UploadPackRequest request = UploadPackRequest.forRefs(advertisement.getRefs());
        byte[] pack = transport.fetchPack(request);

        PackParser parser = new PackParser(repository.getObjectStore(), config.isVerifyPackChecksum());
        PackParseResult packResult = parser.parse(pack);

        if (!hasHead) {
            logger.warn("Remote HEAD refers to nonexistent ref, unable to checkout");
            return new CloneResult(repository, refs, packResult, null);
        }

        CheckoutMaterializer materializer = new CheckoutMaterializer(repository.getObjectStore(),
                repository.getRefStore());
        CheckoutResult checkoutResult = materializer.checkoutHead(repository.getWorkingDirectory());

        logger.info("Cloned {} refs, {} objects, {} files into {}", refs.size(), packResult.getEntryCount(),
                checkoutResult.getFiles().size(), repository.getWorkingDirectory());
        return new CloneResult(repository, refs, packResult, checkoutResult);
    }

    /**
     * Used when the remote does not advertise HEAD: prefer main, then master,
     * then the first branch.
     */
    private static boolean pointHeadAtDefaultBranch(GitRepository repository, RefAdvertisement advertisement)
            throws RepositoryException {
        String target = null;
        for (String candidate : DEFAULT_BRANCHES) {
            if (advertisement.findRef(candidate).isPresent()) {
                target = candidate;
                break;
            }
        }
        if (target == null) {
            target = advertisement.getRefs().stream()
                    .map(AdvertisedRef::getName)
                    .filter(name -> name.startsWith(BRANCH_PREFIX))
                    .findFirst()
                    .orElse(null);
        }
        if (target == null) {
            return false;
        }
        logger.debug("Remote did not advertise HEAD, using {}", target);
        repository.getRefStore().writeRef(Ref.symbolic(Ref.HEAD, target));
        return true;
    }

    private static void ensureUsableTarget(Path directory) throws RepositoryException {
        try {
            if (!FileUtils.isEmptyDirectory(directory)) {
                throw new RepositoryException("Destination path '" + directory
                        + "' already exists and is not an empty directory");
            }
        } catch (IOException e) {
            throw new RepositoryException("Cannot inspect destination path " + directory, e);
        }
    }
}
