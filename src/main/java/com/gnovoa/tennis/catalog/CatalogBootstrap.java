package com.gnovoa.tennis.catalog;

import com.gnovoa.tennis.config.SchedulerProperties;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public final class CatalogBootstrap {

    private final SchedulerProperties props;
    private final CatalogLoader loader;

    public CatalogBootstrap(SchedulerProperties props, CatalogLoader loader) {
        this.props = props;
        this.loader = loader;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        String seed = props.catalog().seedFile();
        if (seed == null || seed.isBlank()) return;
        loader.load(seed);
    }
}
