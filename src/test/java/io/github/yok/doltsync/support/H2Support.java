package io.github.yok.doltsync.support;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.database.IDatabaseConnection;
import org.dbunit.dataset.ITable;

/**
 * H2 をMySQL互換モードで利用するテスト支援ユーティリティです。
 *
 * <p>
 * 各接続は一意なインメモリDBを指し、自動コミットは無効です。テーブル内容の検証には DBUnit の
 * {@link ITable} を用います。
 * </p>
 */
public final class H2Support {

    private H2Support() {}

    /**
     * 新しいインメモリDBへの接続を開きます。
     *
     * @param prefix DB名の接頭辞
     * @return 自動コミット無効の接続
     * @throws SQLException 接続に失敗した場合
     */
    public static Connection open(String prefix) throws SQLException {
        String name = prefix + "_" + UUID.randomUUID().toString().replace("-", "");
        Connection connection = DriverManager.getConnection("jdbc:h2:mem:" + name
                + ";MODE=MySQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1", "sa", "");
        connection.setAutoCommit(false);
        return connection;
    }

    /**
     * SQL を順に実行してコミットします。
     *
     * @param connection 接続
     * @param sqls 実行するSQL
     * @throws SQLException 実行に失敗した場合
     */
    public static void execute(Connection connection, String... sqls) throws SQLException {
        try (Statement st = connection.createStatement()) {
            for (String sql : sqls) {
                st.execute(sql);
            }
        }
        connection.commit();
    }

    /**
     * クエリ結果を DBUnit のテーブルとして取得します。
     *
     * <p>
     * 返却されるテーブルはキャッシュ済みのため、接続を閉じずに利用できます。
     * </p>
     *
     * @param connection 接続
     * @param name テーブル名
     * @param sql クエリ
     * @return クエリ結果
     * @throws SQLException クエリに失敗した場合
     * @throws DatabaseUnitException DBUnit の変換に失敗した場合
     */
    public static ITable query(Connection connection, String name, String sql)
            throws SQLException, DatabaseUnitException {
        IDatabaseConnection db = new DatabaseConnection(connection);
        return db.createQueryTable(name, sql);
    }
}
