package com.prepair.backend.config;

import com.prepair.backend.util.Lexicon;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

@Configuration
@Slf4j
public class LexiconConfig {

    static final String STOP_WORDS_PATH = "lexicon/stopwords.txt";

    /**
     * Stop words shared by the lexical analyzer and copy detector, read once at startup.
     */
    @Bean
    public Lexicon lexicon() {
        try (InputStream in = new ClassPathResource(STOP_WORDS_PATH).getInputStream()) {
            Lexicon lexicon = Lexicon.load(in);
            log.info("📚 Loaded {} stop words from {}", lexicon.size(), STOP_WORDS_PATH);
            return lexicon;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not load stop words from " + STOP_WORDS_PATH, e);
        }
    }
}
