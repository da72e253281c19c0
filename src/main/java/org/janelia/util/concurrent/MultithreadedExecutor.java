package org.janelia.util.concurrent;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;
import java.util.function.IntFunction;

/**
 * Splits an indexed workload over a fixed number of worker threads.
 * Index {@code i} is processed by worker {@code i % numThreads}.
 */
public class MultithreadedExecutor implements AutoCloseable
{
	private final ExecutorService threadPool;
	private final int numThreads;

	public MultithreadedExecutor()
	{
		// reserve one thread for the OS
		this( Math.max( Runtime.getRuntime().availableProcessors() - 1, 1 ) );
	}

	public MultithreadedExecutor( final int numThreads )
	{
		this( Executors.newFixedThreadPool( numThreads ), numThreads );
	}

	public MultithreadedExecutor( final ExecutorService threadPool, final int numThreads )
	{
		if ( numThreads <= 0 )
			throw new IllegalArgumentException( "number of threads should be positive, got " + numThreads );

		this.threadPool = threadPool;
		this.numThreads = numThreads;
	}

	@Override
	public void close()
	{
		threadPool.shutdown();
	}

	public int getNumThreads()
	{
		return numThreads;
	}

	public void run( final IntConsumer func, final int totalSize ) throws InterruptedException, ExecutionException
	{
		final AtomicInteger ai = new AtomicInteger();
		final List< Future< ? > > futures = new ArrayList<>();

		for ( int ithread = 0; ithread < Math.min( numThreads, totalSize ); ++ithread )
			futures.add( threadPool.submit( () ->
			{
				final int myNumber = ai.getAndIncrement();
				for ( int i = myNumber; i < totalSize; i += numThreads )
					func.accept( i );
			} ) );

		for ( final Future< ? > future : futures )
			future.get();
	}

	/**
	 * Evaluates {@code func} for every index in [0, totalSize) and collects the results in index order.
	 */
	public < R > List< R > map( final IntFunction< R > func, final int totalSize ) throws InterruptedException, ExecutionException
	{
		final Object[] results = new Object[ totalSize ];
		run( i -> results[ i ] = func.apply( i ), totalSize );

		@SuppressWarnings( "unchecked" )
		final List< R > resultsList = ( List< R > ) Arrays.asList( results );
		return resultsList;
	}
}
