package work.lcod.tester.cli;

import picocli.CommandLine;

/**
 * Reports the jar's implementation version and the JVM running the tests.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        return new String[] {
            "lcod-tester " + (implementationVersion != null ? implementationVersion : "development"),
            "JVM: " + System.getProperty("java.version") + " (" + System.getProperty("java.vendor") + ")"
        };
    }
}
