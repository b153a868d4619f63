package io.github.yok.doltsync.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import io.github.yok.doltsync.model.ChangeOperation;
import io.github.yok.doltsync.model.OnConflictPolicy;
import org.junit.jupiter.api.Test;

class WriteKindTest {

    @Test
    void resolve_正常ケース_UPDATEポリシー_操作ごとの書き込み種別が返ること() {
        assertEquals(WriteKind.INSERT,
                WriteKind.resolve(ChangeOperation.INSERT, OnConflictPolicy.UPDATE, false));
        assertEquals(WriteKind.UPSERT,
                WriteKind.resolve(ChangeOperation.UPDATE, OnConflictPolicy.UPDATE, false));
        assertEquals(WriteKind.DELETE,
                WriteKind.resolve(ChangeOperation.DELETE, OnConflictPolicy.UPDATE, false));
    }

    @Test
    void resolve_正常ケース_IGNOREポリシー_削除以外は存在しない場合のみ挿入となること() {
        assertEquals(WriteKind.INSERT_IF_ABSENT,
                WriteKind.resolve(ChangeOperation.INSERT, OnConflictPolicy.IGNORE, false));
        assertEquals(WriteKind.INSERT_IF_ABSENT,
                WriteKind.resolve(ChangeOperation.UPDATE, OnConflictPolicy.IGNORE, false));
        assertEquals(WriteKind.DELETE,
                WriteKind.resolve(ChangeOperation.DELETE, OnConflictPolicy.IGNORE, false));
    }

    @Test
    void resolve_正常ケース_スナップショットの挿入_UPDATEポリシーではUPSERTとなること() {
        assertEquals(WriteKind.UPSERT,
                WriteKind.resolve(ChangeOperation.INSERT, OnConflictPolicy.UPDATE, true));
        assertEquals(WriteKind.INSERT_IF_ABSENT,
                WriteKind.resolve(ChangeOperation.INSERT, OnConflictPolicy.IGNORE, true));
        assertEquals(WriteKind.DELETE,
                WriteKind.resolve(ChangeOperation.DELETE, OnConflictPolicy.UPDATE, true));
    }
}
