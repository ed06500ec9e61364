package com.apelier.aiengine.features.pipeline.app;

import com.apelier.aiengine.support.TestImages;
import org.junit.jupiter.api.Test;
import org.opencv.core.Mat;

import static org.junit.jupiter.api.Assertions.*;

class RunWorkingSetTest {
    
    @Test
    void replacingProcessedImageReleasesThePreviousOne() {
        try (RunWorkingSet workingSet = new RunWorkingSet()) {
            Mat first = TestImages.gray(10, 10, 50);
            Mat second = TestImages.gray(10, 10, 60);
            
            workingSet.putProcessed("a", first);
            workingSet.putProcessed("a", second);
            
            assertTrue(first.empty());
            assertSame(second, workingSet.processed("a").orElseThrow());
        }
    }
    
    @Test
    void evictDropsBytesAndImageOfOnePhoto() {
        try (RunWorkingSet workingSet = new RunWorkingSet()) {
            Mat image = TestImages.gray(10, 10, 50);
            workingSet.putOriginal("a", new byte[] {1});
            workingSet.putOriginal("b", new byte[] {2});
            workingSet.putProcessed("a", image);
            
            workingSet.evict("a");
            
            assertTrue(workingSet.original("a").isEmpty());
            assertTrue(workingSet.processed("a").isEmpty());
            assertTrue(image.empty());
            assertTrue(workingSet.original("b").isPresent());
        }
    }
    
    @Test
    void closeReleasesEverythingAndRejectsNewEntries() {
        RunWorkingSet workingSet = new RunWorkingSet();
        Mat image = TestImages.gray(10, 10, 50);
        workingSet.putOriginal("a", new byte[] {1});
        workingSet.putProcessed("a", image);
        
        workingSet.close();
        
        assertTrue(workingSet.isClosed());
        assertTrue(workingSet.isEmpty());
        assertTrue(image.empty());
        assertThrows(IllegalStateException.class, () -> workingSet.putOriginal("b", new byte[] {2}));
    }
}
