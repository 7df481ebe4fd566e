package pfl.domain.alert;

/**
 * One delivery target of a channel. {@code userId} is null for targets that are not users,
 * e.g. a webhook; {@code provider} tells the channel how to talk to the address.
 * @since 19/01/2026
 */
public record Recipient(Long userId, String name, String address, String provider) {

    public static Recipient user(long userId, String name, String address) {
        return new Recipient(userId, name, address, null);
    }

    @Override
    public String toString() {
        return userId != null ? name + "#" + userId : name;
    }
}
