package jellyvr.core.model.jellyfin;

/**
 * Outcome of one QuickConnect poll.
 *
 * @param state poll state
 * @param userId approved user id (approved only)
 * @param userName approved user name (approved only)
 * @param accessToken token issued for the approving device (approved only)
 */
public record QuickConnectStatus(State state, String userId, String userName, String accessToken) {

    public enum State {
        PENDING,
        APPROVED,
        REJECTED
    }

    public static final QuickConnectStatus PENDING = new QuickConnectStatus(State.PENDING, null, null, null);
    public static final QuickConnectStatus REJECTED = new QuickConnectStatus(State.REJECTED, null, null, null);

    public static QuickConnectStatus approved(String userId, String userName, String accessToken) {
        return new QuickConnectStatus(State.APPROVED, userId, userName, accessToken);
    }

    @Override
    public String toString() {
        return "QuickConnectStatus[state=" + state + ", userId=" + userId + ", userName=" + userName + "]";
    }
}
