package org.ohnlp.cdm.timeline;

import org.ohnlp.cdm.timeline.concurrent.PersonPartitionExecutor;
import org.ohnlp.cdm.timeline.connections.FileBasedDataConnectionImpl;
import org.ohnlp.cdm.timeline.ehr.parsers.ParseContext;
import org.ohnlp.cdm.timeline.ehr.tables.TableReader;
import org.ohnlp.cdm.timeline.structs.VocabularyRegistry;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * The tab-delimited OMOP extract under src/test/resources/omop/basic:
 * <ul>
 *     <li>P1, born 1980-01-01, visit V1 2020-01-01 to 2020-01-05, no death</li>
 *     <li>P2, born 1975-06-15, visits V2 (2019-02-01 to 2019-02-03) and V3 (2019-03-10 to 2019-03-12), died
 *     2019-03-12</li>
 *     <li>P3, born 1990-12-31, no visits</li>
 * </ul>
 * condition_occurrence holds one row of unknown person P9, one of unknown visit V8 and one without a code.
 */
public final class Fixtures {
    private Fixtures() {}

    public static Path basicRoot() {
        try {
            return Paths.get(Fixtures.class.getResource("/omop/basic").toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    public static FileBasedDataConnectionImpl basicConnection() {
        return new FileBasedDataConnectionImpl(basicRoot().toString(), "\t", false);
    }

    public static ParseContext context(PersonPartitionExecutor executor) {
        return new ParseContext(new TableReader(basicConnection()), executor, new VocabularyRegistry());
    }
}
