package io.github.panghy.flowbus;

import io.github.panghy.flowbus.bus.BusProvider;
import io.github.panghy.flowbus.bus.MessageBus;
import io.github.panghy.flowbus.codec.CodecRegistry;
import io.github.panghy.flowbus.error.BusRegistrationException;
import io.github.panghy.flowbus.error.CodecNotFoundException;
import io.github.panghy.flowbus.marshal.CallMarshaler;
import io.github.panghy.flowbus.proxy.AccessFacade;
import io.github.panghy.flowbus.proxy.ExportAdapter;
import io.github.panghy.flowbus.proxy.ImportStub;
import io.github.panghy.flowbus.service.ServiceDescriptor;

import java.lang.reflect.Type;
import java.time.Duration;

/**
 * Everything needed to export, find and call one service.
 *
 * <p>A definition ties a {@link ServiceDescriptor} to the codecs that carry its
 * values, the provider that resolves its bus, and a {@link FlowBusConfiguration}.
 * It is the entry point for both sides of a service:</p>
 * <ul>
 *   <li>the exporting process calls {@link #registerService} with its implementation</li>
 *   <li>the importing process calls {@link #createServiceInterface()} and connects
 *       the returned facade, or simply {@link #createAndConnectService()}</li>
 * </ul>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * ServiceDefinition<Thermostat> thermostats = ServiceDefinition.builder(
 *         ServiceDescriptor.builder(Thermostat.class).serviceName("org.example.Thermostat").build())
 *     .codecs(CodecRegistry.defaults())
 *     .build();
 *
 * // server
 * ExportAdapter<Thermostat> export = thermostats.registerService(new ThermostatImpl());
 *
 * // client
 * Thermostat thermostat = thermostats.createAndConnectService();
 * int celsius = thermostat.getTemperature();
 * }</pre>
 *
 * @param <S> The service interface
 */
public final class ServiceDefinition<S> {

  private final ServiceDescriptor<S> descriptor;
  private final CodecRegistry codecs;
  private final BusProvider busProvider;
  private final FlowBusConfiguration configuration;
  private final CallMarshaler marshaler;

  private ServiceDefinition(Builder<S> builder) {
    this.descriptor = builder.descriptor;
    this.codecs = builder.codecs != null ? builder.codecs : CodecRegistry.defaults();
    this.busProvider = builder.busProvider != null ? builder.busProvider : BusProvider.getDefault();
    this.configuration = builder.configuration;
    this.marshaler = new CallMarshaler(codecs);
  }

  /**
   * Creates a builder for a described service.
   *
   * @param descriptor The service descriptor
   * @param <S>        The service type
   * @return A new builder
   */
  public static <S> Builder<S> builder(ServiceDescriptor<S> descriptor) {
    return new Builder<>(descriptor);
  }

  public ServiceDescriptor<S> descriptor() {
    return descriptor;
  }

  public CodecRegistry codecs() {
    return codecs;
  }

  public FlowBusConfiguration configuration() {
    return configuration;
  }

  CallMarshaler marshaler() {
    return marshaler;
  }

  public String serviceName() {
    return descriptor.getServiceName();
  }

  public String objectPath() {
    return descriptor.getObjectPath();
  }

  public String interfaceName() {
    return descriptor.getInterfaceName();
  }

  /**
   * Resolves the bus the service lives on.
   *
   * @return The connected bus
   */
  public MessageBus bus() {
    return busProvider.getBus(descriptor.getBus());
  }

  /**
   * Exports an implementation of the service on its bus.
   *
   * @param implementation The local implementation
   * @return The adapter; close it to withdraw the service
   * @throws BusRegistrationException if the object path or service name is taken
   */
  public ExportAdapter<S> registerService(S implementation) {
    return ExportAdapter.export(descriptor, implementation, bus(), marshaler,
        configuration.isRollbackOnRegistrationFailure());
  }

  /**
   * Creates an unattached access facade for the service.
   * Every call on it fails with a not-attached error until it is connected.
   *
   * @return The facade proxy
   */
  public S createServiceInterface() {
    return AccessFacade.create(descriptor).getService();
  }

  public boolean isServiceRegistered() {
    return ServiceDirectory.isRegistered(serviceName(), bus());
  }

  /**
   * Blocks until the service is registered, honoring
   * {@link FlowBusConfiguration#getRegistrationWaitTimeoutMs()}.
   *
   * @return true once registered, false on timeout or interruption
   */
  public boolean waitForServiceRegistration() {
    long timeoutMs = configuration.getRegistrationWaitTimeoutMs();
    return ServiceDirectory.waitForRegistration(serviceName(), bus(),
        timeoutMs == 0 ? null : Duration.ofMillis(timeoutMs));
  }

  /**
   * Connects a facade created by {@link #createServiceInterface()}.
   *
   * @param facade The facade proxy
   * @return The outcome of the connect
   */
  public ConnectResult connectService(S facade) {
    return ServiceDirectory.connectService(this, facade);
  }

  public ConnectResult waitAndConnectService(S facade) {
    return ServiceDirectory.waitAndConnectService(this, facade);
  }

  /**
   * Creates a facade, waits for the service and connects the facade to it.
   * If the wait gives up the facade is returned unattached.
   *
   * @return The facade proxy
   */
  public S createAndConnectService() {
    S facade = createServiceInterface();
    waitAndConnectService(facade);
    return facade;
  }

  /**
   * Creates a stub talking directly to the remote service, without a facade.
   *
   * @return A new stub
   */
  public ImportStub<S> createStub() {
    return ImportStub.create(descriptor, bus(), marshaler);
  }

  @Override
  public String toString() {
    return "ServiceDefinition{" + descriptor + '}';
  }

  /**
   * Builder for ServiceDefinition.
   *
   * @param <S> The service interface
   */
  public static final class Builder<S> {
    private final ServiceDescriptor<S> descriptor;
    private CodecRegistry codecs;
    private BusProvider busProvider;
    private FlowBusConfiguration configuration = FlowBusConfiguration.defaultConfig();

    private Builder(ServiceDescriptor<S> descriptor) {
      if (descriptor == null) {
        throw new IllegalArgumentException("Descriptor cannot be null");
      }
      this.descriptor = descriptor;
    }

    /**
     * Sets the codecs. Defaults to {@link CodecRegistry#defaults()}.
     *
     * @param codecs The codec registry
     * @return This builder for chaining
     */
    public Builder<S> codecs(CodecRegistry codecs) {
      if (codecs == null) {
        throw new IllegalArgumentException("Codec registry cannot be null");
      }
      this.codecs = codecs;
      return this;
    }

    /**
     * Sets the bus provider. Defaults to {@link BusProvider#getDefault()}.
     *
     * @param busProvider The bus provider
     * @return This builder for chaining
     */
    public Builder<S> busProvider(BusProvider busProvider) {
      if (busProvider == null) {
        throw new IllegalArgumentException("Bus provider cannot be null");
      }
      this.busProvider = busProvider;
      return this;
    }

    public Builder<S> configuration(FlowBusConfiguration configuration) {
      if (configuration == null) {
        throw new IllegalArgumentException("Configuration cannot be null");
      }
      this.configuration = configuration;
      return this;
    }

    /**
     * Builds the definition.
     *
     * @return A new ServiceDefinition
     * @throws CodecNotFoundException if codec validation is enabled and a wire type has no codec
     */
    public ServiceDefinition<S> build() {
      ServiceDefinition<S> definition = new ServiceDefinition<>(this);
      if (configuration.isValidateCodecsAtDefinition()) {
        for (Type type : descriptor.wireTypes()) {
          if (!definition.codecs.hasCodec(type)) {
            throw new CodecNotFoundException(type);
          }
        }
      }
      return definition;
    }
  }
}
