package io.insights.retail;

import io.insights.core.Record;
import io.insights.core.Transform;
import io.insights.metrics.Metrics;
import io.insights.transform.TransformChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Decode, validate and type one raw dataset, as a chain of two transforms.
 * Decoding failures propagate; validation failures are carried on the result.
 */
public class DatasetIngestor implements Transform<RawDataset, IngestedDataset> {
    private static final Logger log = LoggerFactory.getLogger(DatasetIngestor.class);

    private final TransformChain<RawDataset, IngestedDataset> chain;
    private final Metrics metrics; // optional

    public DatasetIngestor() { this(new CsvRecordDecoder(), null); }

    public DatasetIngestor(CsvRecordDecoder decoder, Metrics metrics) {
        this.metrics = metrics;
        this.chain = TransformChain.of(decoder).then(Transform.mapping(this::assemble));
    }

    @Override
    public List<Record<IngestedDataset>> apply(Record<RawDataset> input) throws Exception {
        return chain.apply(input);
    }

    /** Single-dataset entry point outside a pipeline. */
    public IngestedDataset ingest(RawDataset raw) throws DecodeException {
        try {
            return chain.apply(new Record<>(0, raw.name(), raw)).get(0).payload();
        } catch (DecodeException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("unexpected failure ingesting " + raw.name(), e);
        }
    }

    IngestedDataset assemble(DecodedDataset decoded) {
        ValidationResult validation = SchemaValidator.validate(decoded);
        List<? extends RetailRecord> records = RecordMapper.map(decoded.kind(), decoded.rows());
        String kind = decoded.kind().id();
        if (metrics != null) {
            metrics.counter("ingest." + kind + ".rows").inc(records.size());
            metrics.counter("ingest." + kind + ".warnings").inc(decoded.warnings().size());
            if (!validation.valid()) metrics.counter("ingest." + kind + ".invalid").inc();
        }
        if (validation.valid()) {
            log.info("{} ({}): {} records", decoded.kind().title(), decoded.name(), records.size());
        } else {
            log.info("{} ({}) failed validation: {}", decoded.kind().title(), decoded.name(), validation.errors());
        }
        return new IngestedDataset(decoded.kind(), decoded.name(), validation, decoded.warnings(), records);
    }
}
