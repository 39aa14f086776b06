package io.github.yok.issuesync.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.google.common.base.Preconditions;
import io.github.yok.issuesync.model.Issue;
import io.github.yok.issuesync.model.IssueRepository;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Component;

/**
 * Exports issues as UTF-8 JSON Lines, one object per issue, ordered by ID.
 *
 * <p>
 * Output is written to a temporary file in the destination directory and then moved over the
 * destination, so readers see either the previous export or the complete new one.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonlIssueExporter implements IssueExporter {

    private static final ObjectWriter WRITER = new ObjectMapper().writerFor(Issue.class);

    private final IssueRepository issueRepository;

    @Override
    public int export(Connection conn, Path target) throws SQLException, IOException {
        Preconditions.checkNotNull(target, "target must not be null");
        List<Issue> issues = issueRepository.findAll(conn);

        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
        try {
            try (BufferedWriter writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                for (Issue issue : issues) {
                    writer.write(WRITER.writeValueAsString(issue));
                    writer.write('\n');
                }
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } finally {
            FileUtils.deleteQuietly(tmp.toFile());
        }
        log.info("Exported {} issue(s) to {}", issues.size(), target);
        return issues.size();
    }
}
