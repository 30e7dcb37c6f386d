package im.arun.hoteltree.session;

/**
 * Handle returned by {@link HotelSession#subscribe}; closing it stops further notifications.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
