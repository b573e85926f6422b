package de.hpi.isg.xtab.runner;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.esotericsoftware.kryo.util.DefaultInstantiatorStrategy;
import org.objenesis.strategy.StdInstantiatorStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;

/**
 * Saves and loads {@link Checkpoint}s with Kryo. A checkpoint is first written next to its target file and then
 * moved over it, so that an interrupted save leaves the previous checkpoint intact.
 */
public class CheckpointStore {

    private final Logger logger = LoggerFactory.getLogger(this.getClass());

    private final File file;

    private final Kryo kryo;

    public CheckpointStore(File file) {
        this.file = file;
        this.kryo = new Kryo();
        this.kryo.setRegistrationRequired(false);
        this.kryo.setInstantiatorStrategy(new DefaultInstantiatorStrategy(new StdInstantiatorStrategy()));
    }

    public File getFile() {
        return this.file;
    }

    public boolean exists() {
        return this.file.isFile();
    }

    public void save(Checkpoint checkpoint) throws IOException {
        File directory = this.file.getAbsoluteFile().getParentFile();
        if (directory != null) Files.createDirectories(directory.toPath());
        File tempFile = new File(this.file.getPath() + ".tmp");
        try (Output output = new Output(new FileOutputStream(tempFile, false))) {
            this.kryo.writeObject(output, checkpoint);
        } catch (KryoException e) {
            throw new IOException("Could not write checkpoint to " + tempFile, e);
        }
        Files.move(tempFile.toPath(), this.file.toPath(), StandardCopyOption.REPLACE_EXISTING);
        this.logger.info("Saved {} to {}.", checkpoint, this.file);
    }

    /**
     * @return the saved {@link Checkpoint} or {@code null} if there is none
     */
    public Checkpoint load() throws IOException {
        if (!this.exists()) return null;
        try (Input input = new Input(new FileInputStream(this.file))) {
            Checkpoint checkpoint = this.kryo.readObject(input, Checkpoint.class);
            this.logger.info("Loaded {} from {}.", checkpoint, this.file);
            return checkpoint;
        } catch (KryoException e) {
            throw new IOException("Could not read checkpoint from " + this.file, e);
        }
    }

    public void delete() throws IOException {
        if (Files.deleteIfExists(this.file.toPath())) {
            this.logger.info("Deleted checkpoint {}.", this.file);
        }
    }
}
