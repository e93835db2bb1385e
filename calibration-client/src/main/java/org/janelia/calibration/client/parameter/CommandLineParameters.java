package org.janelia.calibration.client.parameter;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.Serializable;

import org.janelia.calibration.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base parameters for all command line tools.
 *
 * @author Eric Trautman
 */
@Parameters
public class CommandLineParameters implements Serializable {

    @Parameter(
            names = "--help",
            description = "Display this note",
            help = true)
    public transient boolean help;

    private transient JCommander jCommander;

    public CommandLineParameters() {
        this.help = false;
        this.jCommander = null;
    }

    public void parse(final String[] args) throws IllegalArgumentException {
        parse(args, this.getClass().getEnclosingClass(), true);
    }

    /**
     * Parses the arguments into this instance.
     * Usage and parse errors are printed to the JCommander console of this parser.
     *
     * @param  args                 command line arguments.
     * @param  programClass         client class named in the usage text.
     * @param  exitOnHelpOrFailure  exit the JVM with code 1 when help was requested or parsing failed.
     *
     * @return true if the arguments were parsed and help was not requested.
     */
    public boolean parse(final String[] args,
                         final Class<?> programClass,
                         final boolean exitOnHelpOrFailure) throws IllegalArgumentException {

        jCommander = new JCommander(this);
        jCommander.setProgramName("java -cp calibration-client-standalone.jar " + programClass.getName());

        boolean parseFailed = true;
        try {
            jCommander.parse(args);
            validate();
            parseFailed = false;
        } catch (final ParameterException pe) {
            jCommander.getConsole().println("\nERROR: failed to parse command line arguments\n\n" + pe.getMessage());
        } catch (final Throwable t) {
            LOG.error("parse: failed to parse command line arguments", t);
        }

        if (help || parseFailed) {
            jCommander.getConsole().println("");
            jCommander.usage();
            if (exitOnHelpOrFailure) {
                System.exit(1);
            }
        }

        return ! (help || parseFailed);
    }

    /**
     * Checks parsed values that JCommander cannot check on its own.
     * The default implementation accepts everything.
     *
     * @throws ParameterException
     *   if the parsed values are inconsistent.
     */
    protected void validate() throws ParameterException {
    }

    /**
     * @return string representation of these parameters.
     */
    @Override
    public String toString() {
        try {
            return JsonUtils.MAPPER.writeValueAsString(this);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    /**
     * Helper (no pun intended) for testing parameter parsing.
     *
     * @param  parameters  parameters instance to test.
     */
    public static void parseHelp(final CommandLineParameters parameters) {
        parameters.parse(new String[] { "--help" },
                         parameters.getClass().getEnclosingClass(),
                         false);
    }

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineParameters.class);

}
