package jellyvr.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import jellyvr.core.model.session.LoginStatus;
import jellyvr.core.model.session.QuickConnectRequest;

/**
 * Inbound port for the browser login flow.
 *
 * <p>A browser starts a QuickConnect request, shows its code, then polls until
 * the user approves it from an authenticated Jellyfin client. Polls are
 * idempotent: every state transition is persisted, so any number of concurrent
 * or repeated polls agree on the outcome.
 */
public interface LoginManagement {

    /**
     * Start a new QuickConnect request.
     *
     * @param previousSecret secret of the request this browser started before, if any;
     *                       it is superseded when still pending
     * @return the new pending request
     */
    Uni<QuickConnectRequest> startLogin(Optional<String> previousSecret);

    /**
     * Advance a login by polling Jellyfin when needed.
     *
     * @param secret QuickConnect secret
     * @return the login status; unknown when no such request exists
     */
    Uni<LoginStatus> pollLogin(String secret);

    /**
     * Drop an authorized request once its result was shown to the browser, so
     * the one-time password is not kept around.
     *
     * @param secret QuickConnect secret
     * @return Uni completing when the request is removed
     */
    Uni<Void> completeLogin(String secret);
}
