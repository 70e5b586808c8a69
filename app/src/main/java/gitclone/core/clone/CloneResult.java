package gitclone.core.clone;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import gitclone.core.checkout.CheckoutResult;
import gitclone.core.pack.PackParseResult;
import gitclone.core.refs.Ref;
import gitclone.core.repository.GitRepository;

/**
 * Outcome of a clone. Pack and checkout results are absent when the remote
 * had no refs.
 */
public final class CloneResult {
    private final GitRepository repository;
    private final List<Ref> refs;
    private final PackParseResult packResult;
    private final CheckoutResult checkoutResult;

    public CloneResult(GitRepository repository, List<Ref> refs, PackParseResult packResult,
            CheckoutResult checkoutResult) {
        this.repository = repository;
        this.refs = Collections.unmodifiableList(refs);
        this.packResult = packResult;
        this.checkoutResult = checkoutResult;
    }

    public GitRepository getRepository() {
        return repository;
    }

    public List<Ref> getRefs() {
        return refs;
    }

    public Optional<PackParseResult> getPackResult() {
        return Optional.ofNullable(packResult);
    }

    public Optional<CheckoutResult> getCheckoutResult() {
        return Optional.ofNullable(checkoutResult);
    }

    public boolean isEmptyRemote() {
        return packResult == null;
    }
}
