package cli;

import app.ModelBuildCliApp;

/**
 * CLI entrypoint facade. Command handling lives in {@link ModelBuildCliApp}.
 */
public class ModelBuildCli {

    public static void main(String[] args) {
        System.exit(ModelBuildCliApp.run(args).code());
    }
}
