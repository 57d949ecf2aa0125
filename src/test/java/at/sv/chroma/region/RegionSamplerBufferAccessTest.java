package at.sv.chroma.region;

import at.sv.chroma.color.PaletteClassifier;
import at.sv.chroma.color.Rgb;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.intThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RegionSamplerBufferAccessTest {

    @Mock
    private PixelBuffer buffer;

    private RegionSampler sampler;

    @BeforeEach
    void setUp() {
        sampler = new RegionSampler(new PaletteClassifier());
        when(buffer.getWidth()).thenReturn(4);
        when(buffer.getHeight()).thenReturn(4);
    }

    @Test
    void samplePixels_regionExceedsBuffer_onlyReadsInsideBounds() {
        when(buffer.getRgb(anyInt(), anyInt())).thenReturn(new Rgb(10, 20, 30));

        assertThat(sampler.samplePixels(buffer, -2, -2, 10, 10, 2)).hasSize(4);

        verify(buffer, times(4)).getRgb(anyInt(), anyInt());
        verify(buffer, never()).getRgb(intThat(x -> x < 0 || x >= 4), anyInt());
        verify(buffer, never()).getRgb(anyInt(), intThat(y -> y < 0 || y >= 4));
    }

    @Test
    void sampleMean_regionOutsideBuffer_neverReadsPixels() {
        assertThat(sampler.sampleMean(buffer, 4, 0, 2, 2)).isEqualTo(Rgb.BLACK);

        verify(buffer, never()).getRgb(anyInt(), anyInt());
    }

    @Test
    void sampleMean_readsEverySecondPixel() {
        when(buffer.getRgb(anyInt(), anyInt())).thenReturn(new Rgb(10, 20, 30));

        assertThat(sampler.sampleMean(buffer, 0, 0, 4, 4)).isEqualTo(new Rgb(10, 20, 30));

        verify(buffer).getRgb(0, 0);
        verify(buffer).getRgb(2, 0);
        verify(buffer).getRgb(0, 2);
        verify(buffer).getRgb(2, 2);
        verify(buffer, times(4)).getRgb(anyInt(), anyInt());
    }
}
