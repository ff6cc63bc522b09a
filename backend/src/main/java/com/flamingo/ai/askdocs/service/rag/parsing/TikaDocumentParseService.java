package com.flamingo.ai.askdocs.service.rag.parsing;

import com.flamingo.ai.askdocs.config.RagConfig;
import com.flamingo.ai.askdocs.domain.enums.ParseMode;
import com.flamingo.ai.askdocs.exception.DocumentParseException;
import com.flamingo.ai.askdocs.service.staging.StagedFile;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import java.io.InputStream;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.io.TikaInputStream;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.parser.pdf.PDFParserConfig;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentParseService} backed by Apache Tika's {@link AutoDetectParser}.
 *
 * <p>In {@link ParseMode#OCR} mode PDF pages without a text layer are run through OCR (requires
 * Tesseract on the host). In {@link ParseMode#LAYOUT} mode text is sorted by its position on the
 * page. Each parse runs on the parsing executor; after the configured timeout the worker is
 * interrupted and the parse is abandoned.
 */
@Service
@Slf4j
public class TikaDocumentParseService implements DocumentParseService {

  private final Executor executor;
  private final Duration timeout;
  private final Supplier<Parser> parserFactory;

  @Autowired
  public TikaDocumentParseService(
      @Qualifier("documentParsingExecutor") Executor executor, RagConfig ragConfig) {
    this(executor, ragConfig.getParsing().getTimeout());
  }

  public TikaDocumentParseService(Executor executor, Duration timeout) {
    this(executor, timeout, AutoDetectParser::new);
  }

  @VisibleForTesting
  TikaDocumentParseService(Executor executor, Duration timeout, Supplier<Parser> parserFactory) {
    this.executor = executor;
    this.timeout = timeout;
    this.parserFactory = parserFactory;
  }

  @Override
  @Timed(value = "parse.document", description = "Time to extract text from a staged file")
  public String parse(StagedFile stagedFile, ParseMode mode) {
    log.info("Parsing {} ({} bytes) mode={}", stagedFile.name(), stagedFile.size(), mode);
    FutureTask<String> task = new FutureTask<>(() -> extract(stagedFile, mode));
    try {
      executor.execute(task);
    } catch (RejectedExecutionException e) {
      throw new DocumentParseException("No parser available for " + stagedFile.name(), e);
    }
    try {
      String content = task.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      log.info("Parsed {}: {} chars", stagedFile.name(), content.length());
      return content;
    } catch (TimeoutException e) {
      task.cancel(true);
      throw new DocumentParseException(
          "Parsing " + stagedFile.name() + " timed out after " + timeout, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof DocumentParseException parseException) {
        throw parseException;
      }
      throw new DocumentParseException("Failed to parse " + stagedFile.name(), cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DocumentParseException("Interrupted while parsing " + stagedFile.name(), e);
    }
  }

  private String extract(StagedFile stagedFile, ParseMode mode) {
    Parser parser = parserFactory.get();
    BodyContentHandler handler = new BodyContentHandler(-1);
    Metadata metadata = new Metadata();
    ParseContext context = new ParseContext();
    context.set(Parser.class, parser);
    context.set(PDFParserConfig.class, pdfConfig(mode));

    try (InputStream in = TikaInputStream.get(stagedFile.path())) {
      parser.parse(in, handler, metadata, context);
    } catch (Exception e) {
      log.error("Tika failed on {}: {}", stagedFile.name(), e.getMessage());
      throw new DocumentParseException("Failed to parse " + stagedFile.name(), e);
    }
    return normalizeLineEndings(handler.toString());
  }

  private static PDFParserConfig pdfConfig(ParseMode mode) {
    PDFParserConfig config = new PDFParserConfig();
    if (mode == ParseMode.OCR) {
      config.setOcrStrategy(PDFParserConfig.OCR_STRATEGY.AUTO);
    } else {
      config.setOcrStrategy(PDFParserConfig.OCR_STRATEGY.NO_OCR);
      config.setSortByPosition(true);
    }
    return config;
  }

  static String normalizeLineEndings(String text) {
    return text.replace("\r\n", "\n").replace('\r', '\n');
  }
}
