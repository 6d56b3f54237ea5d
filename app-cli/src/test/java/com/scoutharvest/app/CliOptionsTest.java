package com.scoutharvest.app;

import com.scoutharvest.core.model.ScrapeConfig;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CliOptionsTest {

    @Test
    void parsesAllFlagsAndPositionalUrls() {
        CliOptions o = CliOptions.parse(new String[]{
                "-c", "conf/scrape.yml", "--max-records", "25", "-o", "out/bmw.csv", "-f", "CSV",
                "-u", "https://ex.com/lst/bmw", "https://ex.com/offers/a-1", "-vv"});

        assertThat(o.config()).isEqualTo(Path.of("conf/scrape.yml"));
        assertThat(o.maxRecords()).isEqualTo(25);
        assertThat(o.output()).isEqualTo("out/bmw.csv");
        assertThat(o.format()).isEqualTo(ScrapeConfig.OutputFormat.CSV);
        assertThat(o.startUrls()).containsExactly("https://ex.com/lst/bmw", "https://ex.com/offers/a-1");
        assertThat(o.verbosity()).isEqualTo(2);
        assertThat(o.help()).isFalse();
    }

    @Test
    void flagsOverrideConfig() {
        ScrapeConfig cfg = ScrapeConfig.defaults().setStartUrls(java.util.List.of("https://ex.com/lst/audi"));
        CliOptions.parse(new String[]{"-m", "7", "-f", "json", "-o", "x.json", "https://ex.com/lst/bmw"}).applyTo(cfg);

        assertThat(cfg.getMaxRecords()).isEqualTo(7);
        assertThat(cfg.getOutput().resolvePath()).isEqualTo(Path.of("x.json"));
        assertThat(cfg.effectiveStartUrls()).containsExactly("https://ex.com/lst/bmw");
    }

    @Test
    void noFlagsKeepsConfig() {
        ScrapeConfig cfg = ScrapeConfig.defaults().setMaxRecords(40);
        CliOptions.parse(new String[0]).applyTo(cfg);
        assertThat(cfg.getMaxRecords()).isEqualTo(40);
    }

    @Test
    void rejectsBadInput() {
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"--bogus"}))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--bogus");
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"-m", "zero"}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"-m", "0"}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"-f", "xml"}))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("xml");
        assertThatThrownBy(() -> CliOptions.parse(new String[]{"-c"}))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("Missing value");
    }
}
