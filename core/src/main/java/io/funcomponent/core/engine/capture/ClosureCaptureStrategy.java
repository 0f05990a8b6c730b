package io.funcomponent.core.engine.capture;

import io.funcomponent.core.engine.PythonLiterals;
import io.funcomponent.core.model.CompileOptions;
import io.funcomponent.core.model.FunctionDefinition;
import io.funcomponent.core.spi.CaptureStrategy;
import io.funcomponent.core.spi.ClosureSerializer;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Captures a function as a serialized closure restored with {@code pickle} inside the container.
 *
 * <p>The generated loader installs {@code cloudpickle} when the image lacks it (globally first,
 * then for the current user), then compares the interpreter version that produced the payload
 * with the running one. A different major version, or a pair that straddles 3.6, raises
 * {@code RuntimeError} at run time; any other difference only prints a warning.
 */
public final class ClosureCaptureStrategy implements CaptureStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(ClosureCaptureStrategy.class);

    /** Pinned cloudpickle requirement installed when the image does not provide it. */
    public static final String DEFAULT_CLOUDPICKLE_REQUIREMENT = "cloudpickle==1.1.1";

    private static final String INSTALLER_TEMPLATE = """
            import sys
            try:
                import cloudpickle as _cloudpickle
            except ImportError:
                import subprocess
                try:
                    print("cloudpickle is not installed. Installing it globally", file=sys.stderr)
                    subprocess.run([sys.executable, "-m", "pip", "install", "%1$s", "--quiet"], env={"PIP_DISABLE_PIP_VERSION_CHECK": "1"}, check=True)
                    print("Installed cloudpickle globally", file=sys.stderr)
                except Exception:
                    print("Failed to install cloudpickle globally. Installing for the current user.", file=sys.stderr)
                    subprocess.run([sys.executable, "-m", "pip", "install", "%1$s", "--user", "--quiet"], env={"PIP_DISABLE_PIP_VERSION_CHECK": "1"}, check=True)
                    print("Installed cloudpickle for the current user", file=sys.stderr)
                    # pip does not refresh sys.path, and the user site directory is absent from it if it did not exist at startup
                    import site
                    sys.path.append(site.getusersitepackages())
                import cloudpickle as _cloudpickle
                print("cloudpickle loaded successfully after installing.", file=sys.stderr)
            """;

    private static final String LOADER_TEMPLATE = """
            pickler_python_version = %1$s
            current_python_version = tuple(sys.version_info)
            if (
                current_python_version[0] != pickler_python_version[0] or
                current_python_version[0] == 3 and ((pickler_python_version[1] < 6) != (current_python_version[1] < 6))
                ):
                raise RuntimeError("Incompatible python versions: " + str(current_python_version) + " instead of " + str(pickler_python_version))

            if current_python_version != pickler_python_version:
                print("Warning!: Different python versions. The code may crash! Current environment python version: " + str(current_python_version) + ". Component code python version: " + str(pickler_python_version), file=sys.stderr)

            import base64
            import pickle

            %2$s = pickle.loads(base64.b64decode(%3$s))
            """;

    private final ClosureSerializer closureSerializer;
    private final String cloudpickleRequirement;

    public ClosureCaptureStrategy(ClosureSerializer closureSerializer) {
        this(closureSerializer, DEFAULT_CLOUDPICKLE_REQUIREMENT);
    }

    public ClosureCaptureStrategy(ClosureSerializer closureSerializer, String cloudpickleRequirement) {
        this.closureSerializer = Objects.requireNonNull(closureSerializer, "closureSerializer must not be null");
        this.cloudpickleRequirement =
                Objects.requireNonNull(cloudpickleRequirement, "cloudpickleRequirement must not be null");
    }

    @Override
    public String capture(FunctionDefinition function, CompileOptions options) {
        List<String> modules = options.modulesToCapture().isEmpty()
                ? List.of(function.module())
                : options.modulesToCapture();
        ClosureSerializer.SerializedClosure closure = closureSerializer.serialize(function, modules);
        String encoded = Base64.getEncoder().encodeToString(closure.payload());
        LOG.debug(
                "Serialized closure of '{}': modules={} payload_bytes={} python={}",
                function.name(),
                modules,
                closure.payload().length,
                closure.producerVersion().toPythonTuple());

        return INSTALLER_TEMPLATE.formatted(cloudpickleRequirement)
                + "\n"
                + LOADER_TEMPLATE.formatted(
                        closure.producerVersion().toPythonTuple(), function.name(), PythonLiterals.bytes(encoded));
    }
}
