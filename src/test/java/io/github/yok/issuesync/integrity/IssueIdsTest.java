package io.github.yok.issuesync.integrity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class IssueIdsTest {

    @Test
    void firstSeparatorPrefix_正常ケース_子IDを指定する_親IDが返ること() {
        assertEquals(Optional.of("bd-abc123"), IssueIds.firstSeparatorPrefix("bd-abc123.1"));
    }

    @Test
    void firstSeparatorPrefix_正常ケース_孫IDを指定する_最初の区切り文字より前が返ること() {
        assertEquals(Optional.of("bd-abc123"), IssueIds.firstSeparatorPrefix("bd-abc123.1.1"));
    }

    @Test
    void firstSeparatorPrefix_正常ケース_ルートIDを指定する_emptyが返ること() {
        assertEquals(Optional.empty(), IssueIds.firstSeparatorPrefix("bd-abc123"));
    }

    @Test
    void firstSeparatorPrefix_正常ケース_先頭が区切り文字である_空文字が返ること() {
        assertEquals(Optional.of(""), IssueIds.firstSeparatorPrefix(".1"));
    }

    @Test
    void firstSeparatorPrefix_正常ケース_nullを指定する_emptyが返ること() {
        assertEquals(Optional.empty(), IssueIds.firstSeparatorPrefix(null));
    }

    @Test
    void isChild_正常ケース_区切り文字の有無で判定する_結果が返ること() {
        assertTrue(IssueIds.isChild("bd-1.2"));
        assertFalse(IssueIds.isChild("bd-1"));
    }
}
