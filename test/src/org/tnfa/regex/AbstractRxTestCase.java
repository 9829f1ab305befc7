/* @LICENSE@  
 */

package org.tnfa.regex;

import static org.tnfa.regex.Misc.LS;

import java.util.BitSet;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import junit.framework.TestCase;

public abstract class AbstractRxTestCase extends TestCase {

    protected static final Logger logger = Logger.getLogger("org.tnfa.regex.test");
    protected static final Level level = Level.FINEST; 
    
    static {
        boolean assertsEnabled = false;
        assert assertsEnabled = true; // Intentional side effect!!!
        if (!assertsEnabled){
            throw new RuntimeException("Asserts must be enabled!!!");
        }
    } 

    public AbstractRxTestCase(String name) {
        super(name);
    }

    private Logger rxLogger = Logger.getLogger("org.tnfa.regex");
    private Handler rxHandler = null;
    private Level rxLevel = null;
    
    /**
     * Captures the messages of the regex package logger into {@link #result},
     * one per line, until tearDown.
     */
    protected void logRx(Level level) {
        if (rxHandler != null) return;
        rxHandler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                if (isLoggable(record)) {
                    result.append(record.getMessage()).append(LS);
                }
            }
            @Override
            public void flush() {}
            @Override
            public void close() {}
        };
        rxHandler.setLevel(level);
        rxLevel = rxLogger.getLevel();
        rxLogger.setLevel(level);
        rxLogger.addHandler(rxHandler);
    }
    protected void logRx() {
        logRx(level);
    }

    String loggingPropertiesFile;
    protected void setUp() throws Exception {
        super.setUp();
        loggingPropertiesFile = System.getProperty(
            "java.util.logging.config.file");
        logger.entering(this.getClass().getSimpleName(), this.getName());
    }

    protected void tearDown() throws Exception {
        if (rxHandler != null) {
            rxLogger.removeHandler(rxHandler);
            rxLogger.setLevel(rxLevel);
            rxHandler = null;
        }
        logger.exiting(this.getClass().getSimpleName(), this.getName());
        super.tearDown();
        result.delete(0, result.length());
    }
    
    protected final StringBuilder result = new StringBuilder();

    protected static BitSet pos(Integer... integers) {
        BitSet ret = new BitSet();
        for (int i : integers) {
            ret.set(i);
        }
        return ret;
    }
    
    /**
     * The {@link NFA} behind a freshly compiled {@link Pattern} - useful for
     * logging and testing.
     */
    protected static NFA nfaOf(String regex) {
        return Pattern.NFAfor(Pattern.compile(regex));
    }

    /*
     * wrapper for the line separator needed by subclasses outside package
     */
    protected static String ls() {
        return LS;
    }
}
