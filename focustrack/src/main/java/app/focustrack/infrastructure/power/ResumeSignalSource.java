package app.focustrack.infrastructure.power;

/**
 * Source of OS resume-from-suspend signals.
 */
public interface ResumeSignalSource {

    /**
     * Register a callback run on every resume signal.
     *
     * @return handle that detaches the callback; detaching twice is a no-op
     */
    Registration onResume(Runnable callback);

    interface Registration {
        void remove();
    }
}
