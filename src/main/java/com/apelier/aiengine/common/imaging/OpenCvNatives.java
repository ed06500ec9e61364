package com.apelier.aiengine.common.imaging;

import nu.pattern.OpenCV;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the OpenCV native library bundled in the openpnp artifact, once per process.
 * Every class that allocates a {@code Mat} calls {@link #ensureLoaded()} first.
 */
public final class OpenCvNatives {
    
    private static final Logger log = LoggerFactory.getLogger(OpenCvNatives.class);
    
    private static volatile boolean loaded;
    
    private OpenCvNatives() {
    }
    
    public static void ensureLoaded() {
        if (loaded) {
            return;
        }
        synchronized (OpenCvNatives.class) {
            if (!loaded) {
                OpenCV.loadLocally();
                loaded = true;
                log.info("OpenCV native library loaded");
            }
        }
    }
}
