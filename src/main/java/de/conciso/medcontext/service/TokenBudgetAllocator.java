package de.conciso.medcontext.service;

import de.conciso.medcontext.model.BundleEntry;
import de.conciso.medcontext.model.ContextBundle;
import de.conciso.medcontext.model.ContextSection;
import de.conciso.medcontext.model.ValidationException;
import de.conciso.medcontext.token.TokenizationException;
import de.conciso.medcontext.token.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Bringt Kontext-Abschnitte auf ein festes Token-Budget.
 *
 * <p>Passt alles ins Budget, bleiben alle Abschnitte unverändert. Sonst werden die Abschnitte
 * in aufsteigender Priorität vollständig übernommen, solange sie passen; der erste, der nicht
 * mehr passt, wird am Ende auf das Restbudget gekürzt, alle folgenden entfallen.
 * Gekürzt wird immer über Encode/Decode des Tokenizers, nie zeichenweise.
 */
@Component
public class TokenBudgetAllocator {

    private static final Logger log = LoggerFactory.getLogger(TokenBudgetAllocator.class);

    public ContextBundle assemble(List<ContextSection> sections, int maxTokens, Tokenizer tokenizer) {
        validate(sections, maxTokens, tokenizer);

        // stable: equal priorities keep caller order
        List<Measured> measured = sections.stream()
                .sorted(Comparator.comparingInt(ContextSection::priority))
                .map(s -> measure(s, tokenizer))
                .toList();
        int total = measured.stream().mapToInt(Measured::tokenCount).sum();

        if (total <= maxTokens) {
            List<BundleEntry> entries = measured.stream().map(Measured::whole).toList();
            log.debug("Context fits: {} / {} tokens in {} section(s)", total, maxTokens, entries.size());
            return new ContextBundle(entries, maxTokens, total, false);
        }

        List<BundleEntry> entries = new ArrayList<>();
        int remaining = maxTokens;
        for (Measured m : measured) {
            if (m.tokenCount() <= remaining) {
                entries.add(m.whole());
                remaining -= m.tokenCount();
                continue;
            }
            if (remaining > 0) {
                Truncation cut = cut(m.text(), m.tokens(), remaining, tokenizer);
                if (cut.tokenCount() == 0) break;
                entries.add(new BundleEntry(m.section().label(), cut.text(), cut.tokenCount(), true));
                remaining -= cut.tokenCount();
                log.debug("Section '{}' truncated: {} → {} tokens", m.section().label(), m.tokenCount(), cut.tokenCount());
            }
            break;
        }

        int used = maxTokens - remaining;
        log.info("Context over budget ({} > {} tokens): kept {} of {} section(s), {} tokens used",
                total, maxTokens, entries.size(), measured.size(), used);
        return new ContextBundle(entries, maxTokens, used, true);
    }

    /**
     * Kürzt {@code text} auf höchstens {@code maxTokens} Tokens (Ende wird abgeschnitten).
     * Passt der Text bereits, wird genau diese Instanz zurückgegeben.
     */
    public String truncate(String text, int maxTokens, Tokenizer tokenizer) {
        if (text == null) throw new ValidationException("Text must not be null");
        if (maxTokens < 0) throw new ValidationException("maxTokens must not be negative, was " + maxTokens);
        if (tokenizer == null) throw new ValidationException("Tokenizer must not be null");

        int[] tokens = encode(tokenizer, text);
        if (tokens.length <= maxTokens) {
            return text;
        }
        return cut(text, tokens, maxTokens, tokenizer).text();
    }

    // --- helpers ---

    private record Measured(ContextSection section, String text, int[] tokens) {
        int tokenCount() {
            return tokens.length;
        }

        BundleEntry whole() {
            return new BundleEntry(section.label(), text, tokens.length, false);
        }
    }

    private record Truncation(String text, int tokenCount) {}

    private Measured measure(ContextSection section, Tokenizer tokenizer) {
        String text = section.serialize();
        return new Measured(section, text, encode(tokenizer, text));
    }

    /**
     * Decodes the first {@code limit} tokens of {@code text}. The prefix shrinks one token at a
     * time until it is a real prefix of {@code text} (a token boundary inside a multi-byte
     * character decodes to U+FFFD) and re-encodes to at most {@code limit} tokens.
     */
    private Truncation cut(String text, int[] tokens, int limit, Tokenizer tokenizer) {
        for (int n = Math.min(limit, tokens.length); n > 0; n--) {
            String prefix = decode(tokenizer, Arrays.copyOf(tokens, n));
            if (!text.startsWith(prefix)) continue;
            int count = encode(tokenizer, prefix).length;
            if (count <= limit) {
                return new Truncation(prefix, count);
            }
        }
        return new Truncation("", 0);
    }

    private static int[] encode(Tokenizer tokenizer, String text) {
        int[] tokens;
        try {
            tokens = tokenizer.encode(text);
        } catch (TokenizationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TokenizationException("Could not encode text (" + text.length() + " chars)", e);
        }
        if (tokens == null) {
            throw new TokenizationException("Tokenizer returned no tokens for text (" + text.length() + " chars)", null);
        }
        return tokens;
    }

    private static String decode(Tokenizer tokenizer, int[] tokens) {
        String text;
        try {
            text = tokenizer.decode(tokens);
        } catch (TokenizationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TokenizationException("Could not decode " + tokens.length + " token(s)", e);
        }
        if (text == null) {
            throw new TokenizationException("Tokenizer decoded " + tokens.length + " token(s) to null", null);
        }
        return text;
    }

    private static void validate(List<ContextSection> sections, int maxTokens, Tokenizer tokenizer) {
        if (sections == null) {
            throw new ValidationException("Sections must not be null");
        }
        if (maxTokens <= 0) {
            throw new ValidationException("maxTokens must be positive, was " + maxTokens);
        }
        if (tokenizer == null) {
            throw new ValidationException("Tokenizer must not be null");
        }
        Set<String> labels = new HashSet<>();
        for (ContextSection section : sections) {
            if (section == null) {
                throw new ValidationException("Sections must not contain null entries");
            }
            if (!labels.add(section.label())) {
                throw new ValidationException("Duplicate section label: " + section.label());
            }
        }
    }
}
