package app.focustrack.service.idle;

/**
 * Observer of idle transitions. Called on the detector's timer or producer
 * thread, so implementations should hand off slow work.
 */
@FunctionalInterface
public interface IdleTransitionListener {

    void onTransition(IdleTransition transition);
}
