package com.apelier.aiengine.features.output.app;

import com.apelier.aiengine.common.config.PipelineProperties;
import com.apelier.aiengine.features.output.domain.GeneratedOutputs;
import com.apelier.aiengine.support.TestImages;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class OutputGeneratorTest {
    
    private final OutputGenerator generator = new OutputGenerator(new PipelineProperties());
    
    @Test
    void producesThreeTiersWithinTheirBounds() throws IOException {
        GeneratedOutputs outputs = generator.generate(TestImages.blocks(3000, 2000, 100, 1L));
        
        BufferedImage full = read(outputs.fullRes());
        BufferedImage web = read(outputs.webRes());
        BufferedImage thumb = read(outputs.thumbnail());
        
        assertEquals(3000, full.getWidth());
        assertEquals(2000, full.getHeight());
        assertEquals(3000, outputs.fullWidth());
        assertEquals(2000, outputs.fullHeight());
        
        assertEquals(2048, web.getWidth());
        assertEquals(1365, web.getHeight(), 1);
        assertEquals(400, thumb.getWidth());
        assertEquals(267, thumb.getHeight(), 1);
    }
    
    @Test
    void smallImagesAreNeverUpscaled() throws IOException {
        GeneratedOutputs outputs = generator.generate(TestImages.gray(300, 200, 128));
        
        for (byte[] tier : new byte[][] {outputs.fullRes(), outputs.webRes(), outputs.thumbnail()}) {
            BufferedImage image = read(tier);
            assertEquals(300, image.getWidth());
            assertEquals(200, image.getHeight());
        }
    }
    
    @Test
    void portraitImagesAreBoundedByHeight() throws IOException {
        GeneratedOutputs outputs = generator.generate(TestImages.gray(1000, 3000, 100));
        
        BufferedImage web = read(outputs.webRes());
        BufferedImage thumb = read(outputs.thumbnail());
        
        assertEquals(2048, web.getHeight());
        assertEquals(400, thumb.getHeight());
        assertTrue(thumb.getWidth() < 400);
    }
    
    private static BufferedImage read(byte[] jpeg) throws IOException {
        assertTrue(jpeg.length > 0);
        assertEquals((byte) 0xFF, jpeg[0]);
        assertEquals((byte) 0xD8, jpeg[1]);
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(jpeg));
        assertNotNull(image);
        return image;
    }
}
