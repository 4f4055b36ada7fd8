package ai.dualpdf.translator.writer;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class SidecarPathsTest {

    private final Path document = Path.of("/library/Smith-2020-Deep.Learning.pdf");

    @Test
    void derivesSiblingNamesFromStem() {
        assertThat(SidecarPaths.stem(document)).isEqualTo("Smith-2020-Deep.Learning");
        assertThat(SidecarPaths.backupFor(document))
                .isEqualTo(Path.of("/library/Smith-2020-Deep.Learning_original.pdf"));
        assertThat(SidecarPaths.sidecarFor(document, SidecarPaths.UPDATED_SIDECAR_SUFFIX))
                .isEqualTo(Path.of("/library/Smith-2020-Deep.Learning.pdf2zh-updated.pdf"));
    }

    @Test
    void temporaryNamesAreUniqueSiblings() {
        Path first = SidecarPaths.temporaryFor(document);
        Path second = SidecarPaths.temporaryFor(document);

        assertThat(first.getParent()).isEqualTo(document.getParent());
        assertThat(first.getFileName().toString()).matches("Smith-2020-Deep\\.Learning_tmp_[0-9a-f]{8}\\.pdf");
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void recognisesBackupsCaseInsensitively() {
        assertThat(SidecarPaths.isBackup(Path.of("a_original.pdf"))).isTrue();
        assertThat(SidecarPaths.isBackup(Path.of("a_ORIGINAL.PDF"))).isTrue();
        assertThat(SidecarPaths.isBackup(Path.of("original.pdf"))).isFalse();
    }
}
