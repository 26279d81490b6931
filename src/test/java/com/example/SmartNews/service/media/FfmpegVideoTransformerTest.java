package com.example.SmartNews.service.media;

import com.example.SmartNews.config.AppProperties;
import com.example.SmartNews.dto.TransformRequest;
import com.example.SmartNews.dto.TransformResult;
import com.example.SmartNews.enums.ProcessingMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FfmpegVideoTransformerTest {

    @TempDir
    Path dir;

    @Test
    void subtitleIsFoundByStemInPreferenceOrder() throws Exception {
        Path video = Files.write(dir.resolve("vid1.mp4"), new byte[1]);
        Files.writeString(dir.resolve("vid1.vtt"), "WEBVTT");
        Files.writeString(dir.resolve("vid1.en.srt"), "1");

        assertThat(FfmpegVideoTransformer.findSubtitle(video)).contains(dir.resolve("vid1.en.srt"));
        assertThat(FfmpegVideoTransformer.findSubtitle(dir.resolve("other.mp4"))).isEmpty();
    }

    @Test
    void subtitlesFilterEscapesPathSeparators() {
        String filter = FfmpegVideoTransformer.subtitlesFilter(Path.of("/data/it's/C:x.srt"), "FontSize=20");

        assertThat(filter).isEqualTo("subtitles='/data/it\\'s/C\\:x.srt':force_style='FontSize=20'");
    }

    @Test
    void originalModeWithSameContainerCopiesAndKeepsSubtitle() throws Exception {
        Path input = Files.write(dir.resolve("vid1.mp4"), new byte[]{1, 2, 3});
        Path subtitle = Files.writeString(dir.resolve("vid1.en.srt"), "1");
        Path output = dir.resolve("processed").resolve("t1_processed.mp4");
        int[] last = new int[2];

        TransformResult result = new FfmpegVideoTransformer(new AppProperties()).process(TransformRequest.builder()
                .inputPath(input)
                .outputPath(output)
                .mode(ProcessingMode.ORIGINAL)
                .build(), (current, total) -> {
            last[0] = current;
            last[1] = total;
        });

        assertThat(Files.readAllBytes(result.getOutputPath())).containsExactly(1, 2, 3);
        assertThat(result.getSubtitlePath()).isEqualTo(dir.resolve("processed").resolve("t1_processed.srt"));
        assertThat(input).exists();
        assertThat(subtitle).exists();
        assertThat(last).containsExactly(1, 1);
    }

    @Test
    void missingInputIsATransformError() {
        FfmpegVideoTransformer transformer = new FfmpegVideoTransformer(new AppProperties());

        assertThatThrownBy(() -> transformer.process(TransformRequest.builder()
                .inputPath(dir.resolve("none.mp4"))
                .outputPath(dir.resolve("out.mp4"))
                .mode(ProcessingMode.SLOW)
                .build(), null))
                .isInstanceOf(TransformException.class);
    }
}
