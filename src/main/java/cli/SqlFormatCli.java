package cli;

import app.SqlFormatCliApp;


/**
 * CLI entrypoint facade.
 *
 * <p>Option handling and the file loop live in {@link SqlFormatCliApp} so they can be tested
 * without exiting the JVM.</p>
 */
public class SqlFormatCli {

    public static final String PROP_POLICY = "sqlformat.policy";

    public static void main(String[] args) {
        System.exit(SqlFormatCliApp.run(args));
    }
}
