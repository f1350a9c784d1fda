package org.neuralchilli.sentinel.config;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import com.hazelcast.nio.serialization.StreamSerializer;
import org.neuralchilli.sentinel.domain.WorkerRegistration;

import java.io.IOException;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Custom Hazelcast serializers for domain objects.
 */
public class HazelcastSerializers {

    /**
     * Serializer for WorkerRegistration records.
     * Queues are written sorted so equal registrations always produce equal bytes,
     * which {@code IMap.replace(key, old, new)} relies on.
     */
    public static class WorkerRegistrationSerializer implements StreamSerializer<WorkerRegistration> {
        static final int TYPE_ID = 1101;

        @Override
        public void write(ObjectDataOutput out, WorkerRegistration worker) throws IOException {
            out.writeString(worker.id());

            List<String> queues = worker.queues().stream().sorted().toList();
            out.writeInt(queues.size());
            for (String queue : queues) {
                out.writeString(queue);
            }

            out.writeInt(worker.activeTasks());
            writeInstant(out, worker.lastHeartbeat());
            writeInstant(out, worker.startedAt());
        }

        @Override
        public WorkerRegistration read(ObjectDataInput in) throws IOException {
            String id = in.readString();

            int queueCount = in.readInt();
            Set<String> queues = new HashSet<>(queueCount);
            for (int i = 0; i < queueCount; i++) {
                queues.add(in.readString());
            }

            int activeTasks = in.readInt();
            Instant lastHeartbeat = readInstant(in);
            Instant startedAt = readInstant(in);

            return new WorkerRegistration(id, queues, activeTasks, lastHeartbeat, startedAt);
        }

        @Override
        public int getTypeId() {
            return TYPE_ID;
        }

        @Override
        public void destroy() {
        }

        private void writeInstant(ObjectDataOutput out, Instant instant) throws IOException {
            out.writeLong(instant.getEpochSecond());
            out.writeInt(instant.getNano());
        }

        private Instant readInstant(ObjectDataInput in) throws IOException {
            long seconds = in.readLong();
            int nanos = in.readInt();
            return Instant.ofEpochSecond(seconds, nanos);
        }
    }
}
