package com.bridgestats.reserve;

import com.bridgestats.stats.engine.ScheduledPass;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ReserveCheckPass implements ScheduledPass {

    public static final String NAME = "reserve-check";

    private final ReserveReconciler reconciler;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void run() {
        reconciler.checkAndAlert();
    }
}
