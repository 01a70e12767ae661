package cli;

import engine.ScanException;
import engine.ScanJob;
import engine.ScanListener;
import model.Finding;
import model.ScanResults;
import model.Target;

import java.io.PrintWriter;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Печатает ход сканирования в консоль в режиме {@code --verbose}.
 */
final class ConsoleProgressListener implements ScanListener {

    private final PrintWriter out;
    private final AtomicInteger findings = new AtomicInteger();
    private final AtomicInteger errors = new AtomicInteger();

    ConsoleProgressListener(PrintWriter out) {
        this.out = out;
    }

    @Override
    public void onScanStart(ScanJob job) {
        out.println("[*] Scan " + job.getId() + " started: " + job.totalWorkUnits() + " checks");
    }

    @Override
    public void onFinding(Finding finding) {
        findings.incrementAndGet();
        synchronized (out) {
            out.println("[+] [" + finding.getSeverity() + "] " + finding.getTemplateId() + " @ " + finding.getTarget());
        }
    }

    @Override
    public void onScanComplete(ScanResults results) {
        out.println("[*] Scan finished: " + findings.get() + " findings, " + errors.get() + " errors");
    }

    @Override
    public void onError(String templateId, Target target, ScanException error) {
        errors.incrementAndGet();
        synchronized (out) {
            out.println("[-] " + templateId + " @ " + target.getAddress() + ": " + error.getMessage());
        }
    }
}
