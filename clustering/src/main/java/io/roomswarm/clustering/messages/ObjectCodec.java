package io.roomswarm.clustering.messages;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.UncheckedIOException;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.eventbus.MessageCodec;

/**
 * Java serialization on the wire; local deliveries pass the instance as-is, so only immutable types may use it.
 */
public class ObjectCodec<T> implements MessageCodec<T, T> {
   private final Class<T> type;

   public ObjectCodec(Class<T> type) {
      this.type = type;
   }

   @Override
   public void encodeToWire(Buffer buffer, T object) {
      ByteArrayOutputStream bos = new ByteArrayOutputStream();
      try (ObjectOutputStream out = new ObjectOutputStream(bos)) {
         out.writeObject(object);
      } catch (IOException e) {
         throw new UncheckedIOException("Cannot serialize " + object, e);
      }
      byte[] bytes = bos.toByteArray();
      buffer.appendInt(bytes.length);
      buffer.appendBytes(bytes);
   }

   @Override
   public T decodeFromWire(int position, Buffer buffer) {
      int length = buffer.getInt(position);
      byte[] bytes = buffer.getBytes(position + 4, position + 4 + length);
      try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes))) {
         return type.cast(in.readObject());
      } catch (IOException e) {
         throw new UncheckedIOException("Cannot deserialize " + type.getName(), e);
      } catch (ClassNotFoundException e) {
         throw new IllegalStateException("Cannot deserialize " + type.getName(), e);
      }
   }

   @Override
   public T transform(T object) {
      return object;
   }

   @Override
   public String name() {
      // each codec needs a unique name
      return ObjectCodec.class.getName() + ":" + type.getName();
   }

   @Override
   public byte systemCodecID() {
      return -1;
   }
}
