package com.apelier.aiengine.features.storage.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StorageKeysTest {
    
    @Test
    void editedKeyReplacesUploadsSegmentAndForcesJpeg() {
        assertEquals("p1/g1/edited/IMG_001.jpg", StorageKeys.editedKeyFor("p1/g1/uploads/IMG_001.jpg"));
        assertEquals("p1/g1/edited/IMG_002.jpg", StorageKeys.editedKeyFor("p1/g1/uploads/IMG_002.CR2"));
        assertEquals("p1/g1/edited/shot.JPEG", StorageKeys.editedKeyFor("p1/g1/uploads/shot.JPEG"));
    }
    
    @Test
    void forceJpegExtensionHandlesDotsInFoldersAndMissingExtension() {
        assertEquals("a.b/c.jpg", StorageKeys.forceJpegExtension("a.b/c"));
        assertEquals("a/c.jpg", StorageKeys.forceJpegExtension("a/c.png"));
        assertEquals("a/c.jpg", StorageKeys.forceJpegExtension("a/c.jpg"));
    }
    
    @Test
    void outputKeysFollowPhotographerGalleryLayout() {
        StorageKeys.OutputKeys keys = StorageKeys.outputKeys("p1", "g1", "DSC_0042.NEF");
        
        assertEquals("p1/g1/edited/DSC_0042.jpg", keys.editedKey());
        assertEquals("p1/g1/web/DSC_0042.jpg", keys.webKey());
        assertEquals("p1/g1/thumb/DSC_0042.jpg", keys.thumbKey());
    }
    
    @Test
    void stemDropsFoldersAndLastExtensionOnly() {
        assertEquals("wedding.final", StorageKeys.stem("x/y/wedding.final.tif"));
        assertEquals(".hidden", StorageKeys.stem(".hidden"));
        assertEquals("noext", StorageKeys.stem("noext"));
    }
}
