package io.resultgroup;

import java.time.Duration;

final class UnitHooks {

    private UnitHooks() {
    }

    /**
     * Chains two hooks; a failure in one does not keep the other from running.
     */
    static UnitHook compose(final UnitHook first, final UnitHook second) {
        return new UnitHook() {
            @Override
            public void onStart(final UnitInfo info) {
                each(new Call() {
                    @Override
                    public void on(UnitHook hook) {
                        hook.onStart(info);
                    }
                });
            }

            @Override
            public void onSuccess(final UnitInfo info, final Duration duration) {
                each(new Call() {
                    @Override
                    public void on(UnitHook hook) {
                        hook.onSuccess(info, duration);
                    }
                });
            }

            @Override
            public void onFailure(final UnitInfo info, final Throwable error, final Duration duration) {
                each(new Call() {
                    @Override
                    public void on(UnitHook hook) {
                        hook.onFailure(info, error, duration);
                    }
                });
            }

            @Override
            public void onErrorDropped(final UnitInfo info, final Throwable error) {
                each(new Call() {
                    @Override
                    public void on(UnitHook hook) {
                        hook.onErrorDropped(info, error);
                    }
                });
            }

            @Override
            public void onThresholdReached(final UnitInfo info, final int threshold) {
                each(new Call() {
                    @Override
                    public void on(UnitHook hook) {
                        hook.onThresholdReached(info, threshold);
                    }
                });
            }

            private void each(Call call) {
                safely(first, call);
                safely(second, call);
            }
        };
    }

    static void safely(UnitHook hook, Call call) {
        try {
            call.on(hook);
        } catch (Throwable ignored) {
        }
    }

    interface Call {
        void on(UnitHook hook);
    }
}
