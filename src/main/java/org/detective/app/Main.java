package org.detective.app;

import org.detective.analysis.AnalysisReport;
import org.detective.analysis.AnalysisReportFormatter;
import org.detective.analysis.DeadlockAnalyzer;
import org.detective.samples.SampleStates;

import java.util.NoSuchElementException;

/**
 * Command-line entry point: analyzes one named sample state and prints the report.
 */
public class Main {
    /**
     * Runs the analysis.
     *
     * @param args optional sample name; without it every sample is analyzed.
     */
    public static void main(String[] args) {
        DeadlockAnalyzer analyzer = new DeadlockAnalyzer();
        if (args.length == 0) {
            for (String name : SampleStates.names()) {
                printSample(analyzer, name);
            }
            return;
        }
        try {
            printSample(analyzer, args[0]);
        } catch (NoSuchElementException ex) {
            System.err.println(ex.getMessage());
            System.exit(2);
        }
    }

    private static void printSample(DeadlockAnalyzer analyzer, String name) {
        AnalysisReport report = analyzer.analyze(SampleStates.load(name));
        System.out.println("### Sample: " + name);
        System.out.println(AnalysisReportFormatter.format(report));
    }
}
