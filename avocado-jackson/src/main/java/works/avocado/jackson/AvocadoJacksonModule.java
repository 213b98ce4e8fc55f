package works.avocado.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.Deserializers;
import com.fasterxml.jackson.databind.ser.Serializers;
import java.io.IOException;
import works.avocado.Context;
import works.avocado.Variant;
import works.avocado.VocabObject;
import works.avocado.WithContext;
import works.avocado.exceptions.DecodeException;
import works.avocado.xsd.XsdDateTime;
import works.avocado.xsd.XsdDuration;

import static com.fasterxml.jackson.core.JsonToken.VALUE_STRING;

/**
 * Lets an ordinary {@link com.fasterxml.jackson.databind.ObjectMapper ObjectMapper}
 * write the typed values of one schema wherever they appear, using that schema's {@link Bindings}.
 * <p>
 * Values that don't depend on the schema ({@link Context}, {@link XsdDateTime}, {@link XsdDuration})
 * can also be read. Reading typed objects requires knowing which type to expect,
 * so it is done through {@link Bindings#type} and its relatives instead.
 *
 * @see Bindings#module()
 */
public class AvocadoJacksonModule extends Module {
	private final Bindings bindings;

	AvocadoJacksonModule(Bindings bindings) {
		this.bindings = bindings;
	}

	@Override
	public String getModuleName() {
		return getClass().getSimpleName();
	}

	@Override
	public Version version() {
		return Version.unknownVersion();
	}

	@Override
	public void setupModule(SetupContext context) {
		context.addSerializers(new AvocadoSerializers());
		context.addDeserializers(new AvocadoDeserializers());
	}

	private final class AvocadoSerializers extends Serializers.Base {
		@Override
		public JsonSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription beanDesc) {
			Class<?> theClass = type.getRawClass();
			if (VocabObject.class.isAssignableFrom(theClass)) {
				return vocabObjectSerializer();
			} else if (Variant.class.isAssignableFrom(theClass)) {
				return variantSerializer();
			} else if (WithContext.class.isAssignableFrom(theClass)) {
				return withContextSerializer();
			} else if (Context.class.isAssignableFrom(theClass)) {
				return contextSerializer();
			} else if (XsdDateTime.class.isAssignableFrom(theClass)) {
				return dateTimeSerializer();
			} else if (XsdDuration.class.isAssignableFrom(theClass)) {
				return durationSerializer();
			} else {
				return null;
			}
		}

		private JsonSerializer<VocabObject> vocabObjectSerializer() {
			return new JsonSerializer<>() {
				@Override
				public void serialize(VocabObject value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					bindings.typeBinding(value.typeName()).write(value, gen);
				}
			};
		}

		private JsonSerializer<Variant> variantSerializer() {
			return new JsonSerializer<>() {
				@Override
				public void serialize(Variant value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					bindings.variants(value.baseTypeName()).encode(value, gen);
				}
			};
		}

		/**
		 * Writes the {@code @context} and then the members of the body, all in one object.
		 */
		private JsonSerializer<WithContext<?>> withContextSerializer() {
			return new JsonSerializer<>() {
				@Override
				public void serialize(WithContext<?> value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					Object body = value.body();
					if (body instanceof VocabObject object) {
						bindings.document(object.typeName()).encode(new WithContext<>(value.context(), object), gen);
					} else if (body instanceof Variant variant) {
						bindings.variantsDocument(variant.baseTypeName()).encode(new WithContext<>(value.context(), variant), gen);
					} else {
						throw new IllegalArgumentException("Document body must be a VocabObject or Variant, not " + body.getClass().getSimpleName());
					}
				}
			};
		}

		private JsonSerializer<Context> contextSerializer() {
			return new JsonSerializer<>() {
				@Override
				public void serialize(Context value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					bindings.contextBinding().write(value, gen);
				}
			};
		}

		private JsonSerializer<XsdDateTime> dateTimeSerializer() {
			return new JsonSerializer<>() {
				@Override
				public void serialize(XsdDateTime value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					gen.writeString(value.format());
				}
			};
		}

		private JsonSerializer<XsdDuration> durationSerializer() {
			return new JsonSerializer<>() {
				@Override
				public void serialize(XsdDuration value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
					gen.writeString(value.format(bindings.settings().getDurationFormat()));
				}
			};
		}
	}

	private final class AvocadoDeserializers extends Deserializers.Base {
		@Override
		public JsonDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription beanDesc) {
			Class<?> theClass = type.getRawClass();
			if (Context.class.isAssignableFrom(theClass)) {
				return contextDeserializer();
			} else if (XsdDateTime.class.isAssignableFrom(theClass)) {
				return dateTimeDeserializer();
			} else if (XsdDuration.class.isAssignableFrom(theClass)) {
				return durationDeserializer();
			} else {
				return null;
			}
		}

		private JsonDeserializer<Context> contextDeserializer() {
			return new JsonDeserializer<>() {
				@Override
				public Context deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
					try {
						return bindings.contextBinding().read(p);
					} catch (DecodeException e) {
						return ctxt.reportInputMismatch(Context.class, "%s", e.getMessage());
					}
				}
			};
		}

		private JsonDeserializer<XsdDateTime> dateTimeDeserializer() {
			return new JsonDeserializer<>() {
				@Override
				public XsdDateTime deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
					if (p.currentToken() != VALUE_STRING) {
						return (XsdDateTime) ctxt.handleUnexpectedToken(XsdDateTime.class, p);
					}
					try {
						return XsdDateTime.parse(p.getText());
					} catch (DecodeException e) {
						return ctxt.reportInputMismatch(XsdDateTime.class, "%s", e.getMessage());
					}
				}
			};
		}

		private JsonDeserializer<XsdDuration> durationDeserializer() {
			return new JsonDeserializer<>() {
				@Override
				public XsdDuration deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
					if (p.currentToken() != VALUE_STRING) {
						return (XsdDuration) ctxt.handleUnexpectedToken(XsdDuration.class, p);
					}
					try {
						return XsdDuration.parse(p.getText());
					} catch (DecodeException e) {
						return ctxt.reportInputMismatch(XsdDuration.class, "%s", e.getMessage());
					}
				}
			};
		}
	}
}
