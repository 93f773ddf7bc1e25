package io.sqsoffline.invoke;

import java.io.IOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.jar.JarFile;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads handler classes from class directories or jars through a fresh class loader per
 * {@link #resolve}, so a recompiled handler is picked up without restarting.
 *
 * <p>For {@code handlers.Orders.process} the class {@code handlers.Orders} is loaded and the
 * export {@code process} is looked up as either
 * <ol>
 *   <li>a public static field holding a {@link QueueHandler}, {@link CallbackQueueHandler}
 *       or {@link InvocableHandler}, or</li>
 *   <li>when the export is {@code handle}, the class itself, instantiated through its public
 *       no-arg constructor, if it implements one of those interfaces.</li>
 * </ol>
 *
 * <p>The roots must not also be on the parent class loader's classpath, or the parent copy
 * shadows every reload.
 */
public final class ClassDirectoryHandlerLoader implements HandlerLoader, AutoCloseable {
  private static final Logger logger = Logger.getLogger(ClassDirectoryHandlerLoader.class.getName());

  static final String HANDLE_EXPORT = "handle";

  private final List<Path> roots;
  private final ClassLoader parent;
  private final Map<String, URLClassLoader> loaders = new ConcurrentHashMap<>();

  public ClassDirectoryHandlerLoader(List<Path> roots) {
    this(roots, ClassDirectoryHandlerLoader.class.getClassLoader());
  }

  public ClassDirectoryHandlerLoader(List<Path> roots, ClassLoader parent) {
    this.roots = List.copyOf(Objects.requireNonNull(roots, "roots"));
    this.parent = Objects.requireNonNull(parent, "parent");
    if (this.roots.isEmpty()) {
      throw new IllegalArgumentException("roots must not be empty");
    }
  }

  @Override
  public InvocableHandler resolve(String handlerRef) throws HandlerException {
    HandlerRef ref = HandlerRef.parse(handlerRef);
    String resource = ref.module().replace('.', '/') + ".class";
    if (!artifactExists(resource)) {
      throw new HandlerNotFoundException(handlerRef, "Handler class not found: " + ref.module());
    }

    URLClassLoader classLoader = new URLClassLoader("handler:" + handlerRef, urls(handlerRef), parent);
    Class<?> type;
    try {
      type = Class.forName(ref.module(), true, classLoader);
    } catch (ClassNotFoundException | LinkageError e) {
      closeQuietly(handlerRef, classLoader);
      throw new HandlerNotFoundException(handlerRef, "Failed to load handler class " + ref.module(), e);
    }

    InvocableHandler handler;
    try {
      handler = export(handlerRef, type, ref.export());
    } catch (HandlerException e) {
      closeQuietly(handlerRef, classLoader);
      throw e;
    }
    URLClassLoader previous = loaders.put(handlerRef, classLoader);
    if (previous != null) {
      logger.fine(() -> "Replaced class loader for " + handlerRef);
      closeQuietly(handlerRef, previous);
    }
    return handler;
  }

  private InvocableHandler export(String handlerRef, Class<?> type, String exportName) throws HandlerException {
    Field field = findStaticField(type, exportName);
    if (field != null) {
      Object value;
      try {
        value = field.get(null);
      } catch (IllegalAccessException e) {
        throw new HandlerNotCallableException(handlerRef, "Export " + exportName + " is not accessible", e);
      }
      InvocableHandler handler = InvocableHandler.adapt(value);
      if (handler == null) {
        throw new HandlerNotCallableException(handlerRef, "Export " + exportName + " is not a handler");
      }
      return handler;
    }
    if (HANDLE_EXPORT.equals(exportName) && isHandlerType(type)) {
      try {
        Constructor<?> constructor = type.getConstructor();
        return InvocableHandler.adapt(constructor.newInstance());
      } catch (ReflectiveOperationException e) {
        throw new HandlerNotCallableException(handlerRef, "Cannot instantiate handler " + type.getName(), e);
      }
    }
    throw new HandlerNotCallableException(handlerRef, "Handler " + exportName + " is not a function");
  }

  private static Field findStaticField(Class<?> type, String name) {
    try {
      Field field = type.getField(name);
      return Modifier.isStatic(field.getModifiers()) ? field : null;
    } catch (NoSuchFieldException e) {
      return null;
    }
  }

  private static boolean isHandlerType(Class<?> type) {
    return !type.isInterface()
        && !Modifier.isAbstract(type.getModifiers())
        && (QueueHandler.class.isAssignableFrom(type)
            || CallbackQueueHandler.class.isAssignableFrom(type)
            || InvocableHandler.class.isAssignableFrom(type));
  }

  private boolean artifactExists(String resource) {
    for (Path root : roots) {
      if (Files.isDirectory(root)) {
        if (Files.isRegularFile(root.resolve(resource))) {
          return true;
        }
      } else if (Files.isRegularFile(root)) {
        try (JarFile jar = new JarFile(root.toFile())) {
          if (jar.getEntry(resource) != null) {
            return true;
          }
        } catch (IOException e) {
          logger.log(Level.WARNING, "Cannot read handler archive " + root, e);
        }
      }
    }
    return false;
  }

  private URL[] urls(String handlerRef) throws HandlerNotFoundException {
    List<URL> urls = new ArrayList<>(roots.size());
    for (Path root : roots) {
      try {
        urls.add(root.toUri().toURL());
      } catch (MalformedURLException e) {
        throw new HandlerNotFoundException(handlerRef, "Invalid handler root " + root, e);
      }
    }
    return urls.toArray(new URL[0]);
  }

  /**
   * Closes the class loader of the last load so its jar files are released. Classes it has
   * already loaded stay usable; classes a running handler has not touched yet can no longer
   * be loaded from it.
   */
  @Override
  public void invalidate(String handlerRef) {
    URLClassLoader previous = loaders.remove(handlerRef);
    if (previous != null) {
      closeQuietly(handlerRef, previous);
    }
  }

  /**
   * Closes the class loaders of the most recent loads.
   */
  @Override
  public void close() {
    for (Map.Entry<String, URLClassLoader> entry : loaders.entrySet()) {
      closeQuietly(entry.getKey(), entry.getValue());
    }
    loaders.clear();
  }

  private static void closeQuietly(String handlerRef, URLClassLoader classLoader) {
    try {
      classLoader.close();
    } catch (IOException e) {
      logger.log(Level.WARNING, "Failed to close class loader for " + handlerRef, e);
    }
  }
}
