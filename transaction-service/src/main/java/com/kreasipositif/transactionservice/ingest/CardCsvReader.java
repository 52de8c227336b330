package com.kreasipositif.transactionservice.ingest;

import com.kreasipositif.transactionservice.domain.RawCard;
import com.kreasipositif.transactionservice.exception.CardSourceException;
import com.kreasipositif.transactionservice.exception.CardSourceException.Kind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.file.FlatFileItemReader;
import org.springframework.batch.item.file.builder.FlatFileItemReaderBuilder;
import org.springframework.batch.item.file.transform.DelimitedLineTokenizer;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads every row of the card CSV into {@link RawCard} records.
 *
 * <p>The first line is the header; its column names are handed to the
 * {@link DelimitedLineTokenizer} so {@link CardFieldSetMapper} can read fields by name.
 * The reader is a plain, non-restartable {@link FlatFileItemReader} driven in a loop; no
 * job repository is involved, the file is read once at startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CardCsvReader {

    private static final List<String> REQUIRED_COLUMNS = List.of(
            CardFieldSetMapper.ID,
            CardFieldSetMapper.CLIENT_ID,
            CardFieldSetMapper.CREDIT_LIMIT,
            CardFieldSetMapper.CARD_TYPE,
            CardFieldSetMapper.CARD_BRAND);

    private final ResourceLoader resourceLoader;
    private final CardFieldSetMapper fieldSetMapper;

    /**
     * Reads all cards from {@code location}.
     *
     * @param location Spring resource location of the CSV
     * @return cards in file order, never empty
     * @throws CardSourceException {@code SOURCE_UNAVAILABLE} when the file is missing, lacks a
     *                             required column or cannot be parsed; {@code SOURCE_EMPTY} when
     *                             it holds no data rows
     */
    public List<RawCard> readAll(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new CardSourceException(Kind.SOURCE_UNAVAILABLE, "Card CSV not found: " + location);
        }

        DelimitedLineTokenizer tokenizer = new DelimitedLineTokenizer(DelimitedLineTokenizer.DELIMITER_COMMA);
        List<String> header = new ArrayList<>();

        FlatFileItemReader<RawCard> reader = new FlatFileItemReaderBuilder<RawCard>()
                .name("cardReader")
                .resource(resource)
                .linesToSkip(1)
                .skippedLinesCallback(line -> {
                    // null for a zero-byte file; the empty header is reported below
                    if (line == null) {
                        return;
                    }
                    header.addAll(parseHeader(line));
                    tokenizer.setNames(header.toArray(String[]::new));
                })
                .lineTokenizer(tokenizer)
                .fieldSetMapper(fieldSetMapper)
                .saveState(false)
                .build();

        List<RawCard> cards = new ArrayList<>();
        try {
            reader.open(new ExecutionContext());
            if (header.isEmpty()) {
                throw new CardSourceException(Kind.SOURCE_EMPTY, "Card CSV is empty: " + location);
            }
            List<String> missing = REQUIRED_COLUMNS.stream().filter(c -> !header.contains(c)).toList();
            if (!missing.isEmpty()) {
                throw new CardSourceException(Kind.SOURCE_UNAVAILABLE,
                        "Card CSV '%s' is missing columns %s".formatted(location, missing));
            }

            RawCard card;
            while ((card = reader.read()) != null) {
                cards.add(card);
            }
        } catch (CardSourceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Error reading card CSV '{}': {}", location, e.getMessage());
            throw new CardSourceException(Kind.SOURCE_UNAVAILABLE,
                    "Unable to read card CSV '%s': %s".formatted(location, e.getMessage()), e);
        } finally {
            reader.close();
        }

        if (cards.isEmpty()) {
            throw new CardSourceException(Kind.SOURCE_EMPTY, "Card CSV has no data rows: " + location);
        }
        log.debug("Read {} cards from '{}'", cards.size(), location);
        return cards;
    }

    private static List<String> parseHeader(String line) {
        // strip a UTF-8 byte order mark left by spreadsheet exports
        String cleaned = line.startsWith("\uFEFF") ? line.substring(1) : line;
        String[] names = new DelimitedLineTokenizer().tokenize(cleaned).getValues();
        return Arrays.stream(names).map(String::trim).toList();
    }
}
